package com.homepurse.analysis.agent;

/**
 * A candidate query as returned by the model, with the model's stated rationale if it gave one.
 */
public record GeneratedSql(String sql, String reason) {
}
