package com.homepurse.analysis.agent;

/**
 * A household-filtered relation the model may query. {@code body} is a SELECT over base tables
 * that restricts rows to the household in the {@code app.household_id} transaction setting.
 */
public record ScopedView(String name, String description, String body) {
}
