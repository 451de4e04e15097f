package com.homepurse.analysis.agent;

import java.util.UUID;

/**
 * The caller abandoned the run. The query stays pending and no partial attempt is written.
 */
public class AnalysisCancelledException extends RuntimeException {

    private final UUID queryId;

    public AnalysisCancelledException(UUID queryId) {
        super("Analysis " + queryId + " was cancelled");
        this.queryId = queryId;
    }

    public UUID queryId() {
        return queryId;
    }
}
