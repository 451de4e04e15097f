package com.homepurse.analysis.agent;

import com.homepurse.analysis.config.HomepurseProperties;
import com.homepurse.analysis.security.RlsGuard;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs an accepted query inside a read-only, household-scoped transaction. The query only ever
 * sees the scoped views, which are injected as CTEs around it.
 */
@Component
public class ScopedQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScopedQueryExecutor.class);

    private final RlsGuard rlsGuard;
    private final ScopedViewCatalog catalog;
    private final ExecutorService executor;
    private final Duration statementTimeout;
    private final int resultLimit;

    public ScopedQueryExecutor(RlsGuard rlsGuard,
                               ScopedViewCatalog catalog,
                               HomepurseProperties properties,
                               @Qualifier("analysisIoExecutor") ExecutorService executor) {
        this.rlsGuard = rlsGuard;
        this.catalog = catalog;
        this.executor = executor;
        this.statementTimeout = properties.analysis().statementTimeout();
        this.resultLimit = properties.analysis().resultLimit();
    }

    public Duration statementTimeout() {
        return statementTimeout;
    }

    /**
     * Completes exceptionally with {@link QueryExecutionException} carrying the database message.
     * Referenced relations must all be allow-listed scoped views, otherwise nothing is executed.
     */
    public CompletableFuture<QueryResult> execute(String acceptedSql, Set<String> referencedTables, UUID householdId) {
        for (String table : referencedTables) {
            if (!catalog.isAllowed(table)) {
                return CompletableFuture.failedFuture(
                        new QueryExecutionException("Relation " + table + " is not a household-scoped view"));
            }
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return run(acceptedSql, householdId);
            } catch (SQLException ex) {
                throw new CompletionException(new QueryExecutionException(databaseMessage(ex), ex));
            }
        }, executor);
    }

    String wrap(String acceptedSql) {
        return catalog.withClause(catalog.allowedViews())
                + "SELECT * FROM (\n" + acceptedSql + "\n) AS agent_result LIMIT " + resultLimit;
    }

    private QueryResult run(String acceptedSql, UUID householdId) throws SQLException {
        String sql = wrap(acceptedSql);
        return rlsGuard.readInHousehold(householdId, statementTimeout, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setQueryTimeout((int) Math.max(1, statementTimeout.toSeconds()));
                statement.setMaxRows(resultLimit);
                try (ResultSet rs = statement.executeQuery()) {
                    QueryResult result = read(rs);
                    log.debug("analysis_execute householdId={} rows={}", householdId, result.rowCount());
                    return result;
                }
            }
        });
    }

    private QueryResult read(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                row.add(normalize(rs.getObject(i)));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    }

    static Object normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Double) {
            return value;
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toString();
        }
        if (value instanceof Time time) {
            return time.toLocalTime().toString();
        }
        return value.toString();
    }

    private static String databaseMessage(SQLException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message.strip();
    }
}
