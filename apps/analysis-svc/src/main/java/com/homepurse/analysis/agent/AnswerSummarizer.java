package com.homepurse.analysis.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a query result into a short answer, a cleaned table and, for two-column label/value
 * results, a chart. Deterministic.
 */
@Component
public class AnswerSummarizer {

    static final String EMPTY_ANSWER =
            "I could not find matching expenses for that question. Try a wider date range or different filters.";
    private static final int PREVIEW_ROWS = 3;
    private static final int MAX_FAILURE_LENGTH = 200;
    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern TIME_LABEL = Pattern.compile("^\\d{4}-\\d{2}(-\\d{2})?([T ].*)?$");
    private static final Set<String> TIME_COLUMN_WORDS = Set.of("date", "day", "week", "month", "year", "period", "quarter");

    public AnalysisAnswer summarize(String question, QueryResult result) {
        AnalysisAnswer.Table table = sanitize(result);
        if (table.rows().isEmpty()) {
            return new AnalysisAnswer(EMPTY_ANSWER, table, null);
        }
        return new AnalysisAnswer(describe(table), table, chart(table));
    }

    public AnalysisAnswer failure(String question, int attempts, String lastFailure) {
        String summary = lastFailure == null || lastFailure.isBlank()
                ? "unknown error"
                : redact(lastFailure.strip().lines().findFirst().orElse(""));
        if (summary.length() > MAX_FAILURE_LENGTH) {
            summary = summary.substring(0, MAX_FAILURE_LENGTH - 3) + "...";
        }
        return new AnalysisAnswer("I could not answer that after " + attempts + " attempt"
                + (attempts == 1 ? "" : "s") + ". Last issue: " + summary, null, null);
    }

    /**
     * Drops internal id columns (unless nothing else is left) and redacts UUID-looking text.
     */
    AnalysisAnswer.Table sanitize(QueryResult result) {
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < result.columns().size(); i++) {
            if (!isInternalId(result.columns().get(i))) {
                keep.add(i);
            }
        }
        if (keep.isEmpty()) {
            for (int i = 0; i < result.columns().size(); i++) {
                keep.add(i);
            }
        }
        List<String> columns = keep.stream().map(result.columns()::get).toList();
        List<List<Object>> rows = new ArrayList<>(result.rowCount());
        for (List<Object> row : result.rows()) {
            List<Object> cleaned = new ArrayList<>(keep.size());
            for (int index : keep) {
                Object cell = row.get(index);
                cleaned.add(cell instanceof String text ? redact(text) : cell);
            }
            rows.add(cleaned);
        }
        return new AnalysisAnswer.Table(columns, rows);
    }

    private String describe(AnalysisAnswer.Table table) {
        if (table.rows().size() == 1 && table.columns().size() == 1) {
            Object value = table.rows().get(0).get(0);
            return humanize(table.columns().get(0)) + ": " + format(value) + ".";
        }
        StringBuilder sb = new StringBuilder();
        int total = table.rows().size();
        sb.append("Found ").append(total).append(total == 1 ? " row." : " rows.");
        for (List<Object> row : table.rows().subList(0, Math.min(PREVIEW_ROWS, total))) {
            sb.append("\n- ");
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(humanize(table.columns().get(i))).append(": ").append(format(row.get(i)));
            }
        }
        if (total > PREVIEW_ROWS) {
            sb.append("\nShowing ").append(PREVIEW_ROWS).append(" of ").append(total).append(" rows.");
        }
        return sb.toString();
    }

    /**
     * A chart needs exactly one label column and one numeric column.
     */
    AnalysisAnswer.Chart chart(AnalysisAnswer.Table table) {
        if (table.columns().size() != 2 || table.rows().isEmpty()) {
            return null;
        }
        boolean firstNumeric = isNumericColumn(table, 0);
        boolean secondNumeric = isNumericColumn(table, 1);
        if (firstNumeric == secondNumeric) {
            return null;
        }
        int valueIndex = secondNumeric ? 1 : 0;
        int labelIndex = 1 - valueIndex;
        List<AnalysisAnswer.Point> points = new ArrayList<>();
        for (List<Object> row : table.rows()) {
            points.add(new AnalysisAnswer.Point(String.valueOf(row.get(labelIndex)), toDouble(row.get(valueIndex))));
        }
        String labelColumn = table.columns().get(labelIndex);
        String chartType = isTimeLike(labelColumn, table, labelIndex) ? "line" : "bar";
        String title = humanize(table.columns().get(valueIndex)) + " by " + humanize(labelColumn).toLowerCase(Locale.ROOT);
        return new AnalysisAnswer.Chart(chartType, title, points);
    }

    private static boolean isNumericColumn(AnalysisAnswer.Table table, int index) {
        boolean sawNumber = false;
        for (List<Object> row : table.rows()) {
            Object cell = row.get(index);
            if (cell instanceof Number) {
                sawNumber = true;
            } else if (!(cell instanceof String text && text.isEmpty())) {
                return false;
            }
        }
        return sawNumber;
    }

    private static boolean isTimeLike(String column, AnalysisAnswer.Table table, int index) {
        String lower = column.toLowerCase(Locale.ROOT);
        for (String word : lower.split("_")) {
            if (TIME_COLUMN_WORDS.contains(word)) {
                return true;
            }
        }
        return table.rows().stream().allMatch(row -> TIME_LABEL.matcher(String.valueOf(row.get(index))).matches());
    }

    private static boolean isInternalId(String column) {
        String lower = column.toLowerCase(Locale.ROOT);
        return lower.equals("id") || lower.endsWith("_id");
    }

    static String redact(String text) {
        return UUID_PATTERN.matcher(text).replaceAll("[hidden]");
    }

    static String humanize(String column) {
        String words = column.replace('_', ' ').strip();
        if (words.isEmpty()) {
            return column;
        }
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    static String format(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%,.2f", ((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return String.format(Locale.ROOT, "%,d", number.longValue());
        }
        String text = String.valueOf(value);
        return text.isEmpty() ? "(none)" : text;
    }

    private static double toDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0d;
    }
}
