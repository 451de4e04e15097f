package com.homepurse.analysis.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read model of a query and its attempts for offline review.
 */
public record AnalysisQueryView(
        UUID id,
        UUID householdId,
        UUID userId,
        String provider,
        String model,
        String question,
        QueryStatus status,
        int attemptCount,
        String finalSql,
        String finalAnswer,
        String failureReason,
        Instant createdAt,
        Instant updatedAt,
        List<Attempt> attempts
) {
    public record Attempt(
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
