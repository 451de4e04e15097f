package com.homepurse.analysis.audit;

/**
 * One attempt as it is written to the audit log. {@code repairReason} is the text fed to the next
 * repair prompt and stays null on the last attempt of a run.
 */
public record AttemptRecord(
        int attemptNumber,
        String generatedSql,
        String llmReason,
        boolean validationOk,
        String validationReason,
        boolean executionOk,
        String dbError,
        String repairReason
) {
    public AttemptRecord {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must start at 1");
        }
        generatedSql = generatedSql == null ? "" : generatedSql;
        if (executionOk && !validationOk) {
            throw new IllegalArgumentException("an attempt cannot execute without passing validation");
        }
    }

    public boolean succeeded() {
        return validationOk && executionOk;
    }
}
