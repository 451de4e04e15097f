package com.homepurse.analysis.security;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens a read-only transaction bound to one household. The scope travels as the transaction
 * local setting {@code app.household_id}, which every scoped view filters on (and which
 * row-level security policies on the base tables may also use). The transaction is always
 * rolled back.
 */
@Component
public class RlsGuard {

    public static final String HOUSEHOLD_SETTING = "app.household_id";

    private static final Logger log = LoggerFactory.getLogger(RlsGuard.class);
    private final DataSource dataSource;

    @FunctionalInterface
    public interface ScopedWork<T> {
        T run(Connection connection) throws SQLException;
    }

    public RlsGuard(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public <T> T readInHousehold(UUID householdId, Duration statementTimeout, ScopedWork<T> work) throws SQLException {
        if (householdId == null) {
            throw new IllegalArgumentException("Household id is required for scoped reads");
        }
        try (Connection connection = dataSource.getConnection()) {
            connection.setReadOnly(true);
            connection.setAutoCommit(false);
            try {
                try (Statement statement = connection.createStatement()) {
                    statement.execute("SET TRANSACTION READ ONLY");
                    statement.execute("SET LOCAL statement_timeout = " + Math.max(1L, statementTimeout.toMillis()));
                }
                try (PreparedStatement scope = connection.prepareStatement("SELECT set_config('" + HOUSEHOLD_SETTING + "', ?, true)")) {
                    scope.setString(1, householdId.toString());
                    scope.execute();
                }
                return work.run(connection);
            } finally {
                rollbackQuietly(connection);
            }
        }
    }

    private void rollbackQuietly(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException ex) {
            log.warn("Failed to roll back scoped read transaction: {}", ex.getMessage());
        }
    }
}
