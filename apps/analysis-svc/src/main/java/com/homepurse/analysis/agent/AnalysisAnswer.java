package com.homepurse.analysis.agent;

import java.util.List;

/**
 * User-facing answer. {@code table} and {@code chart} are optional.
 */
public record AnalysisAnswer(String text, Table table, Chart chart) {

    public record Table(List<String> columns, List<List<Object>> rows) {
        public Table {
            columns = List.copyOf(columns);
            rows = rows.stream().map(List::copyOf).toList();
        }
    }

    public record Chart(String chartType, String title, List<Point> points) {
        public Chart {
            points = List.copyOf(points);
        }
    }

    public record Point(String label, double value) {
    }
}
