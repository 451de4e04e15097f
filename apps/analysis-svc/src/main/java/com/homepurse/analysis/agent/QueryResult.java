package com.homepurse.analysis.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered columns and rows of an executed query. Cells are strings, numbers or booleans rendered
 * as text; SQL NULL becomes the empty string.
 */
public record QueryResult(List<String> columns, List<List<Object>> rows) {

    public QueryResult {
        columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }
}
