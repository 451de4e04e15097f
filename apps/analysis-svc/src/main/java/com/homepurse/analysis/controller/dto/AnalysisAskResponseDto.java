package com.homepurse.analysis.controller.dto;

import java.util.List;
import java.util.UUID;

public record AnalysisAskResponseDto(
        UUID queryId,
        String status,
        String answer,
        TableDto table,
        ChartDto chart,
        String finalSql,
        int attemptCount,
        String traceId
) {
    public record TableDto(List<String> columns, List<List<Object>> rows) {}

    public record ChartDto(String chartType, String title, List<PointDto> points) {}

    public record PointDto(String label, double value) {}
}
