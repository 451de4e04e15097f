package com.homepurse.analysis.agent;

import com.homepurse.analysis.audit.QueryStatus;
import java.util.UUID;

public record AnalysisOutcome(
        UUID queryId,
        QueryStatus status,
        AnalysisAnswer answer,
        String finalSql,
        int attemptCount
) {
}
