package com.homepurse.analysis.controller.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AnalysisQueryResponseDto(
        UUID queryId,
        String question,
        String status,
        String provider,
        String model,
        int attemptCount,
        String finalSql,
        String finalAnswer,
        String failureReason,
        Instant createdAt,
        Instant updatedAt,
        List<AttemptDto> attempts,
        String traceId
) {
    public record AttemptDto(
            int attemptNumber,
            String generatedSql,
            String llmReason,
            boolean validationOk,
            String validationReason,
            boolean executionOk,
            String dbError,
            String repairReason,
            Instant createdAt
    ) {}
}
