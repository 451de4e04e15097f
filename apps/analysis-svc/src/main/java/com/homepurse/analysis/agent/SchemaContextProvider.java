package com.homepurse.analysis.agent;

import com.homepurse.analysis.config.HomepurseProperties;
import com.homepurse.analysis.security.RlsGuard;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Reads column names and types of the allow-listed scoped views from the live database, plus a
 * few distinct household values and the expense date range to ground the prompt. Any failure
 * aborts the whole load.
 */
@Component
public class SchemaContextProvider {

    private static final Logger log = LoggerFactory.getLogger(SchemaContextProvider.class);

    private final RlsGuard rlsGuard;
    private final ScopedViewCatalog catalog;
    private final Duration statementTimeout;
    private final int hintLimit;
    private final Clock clock;

    @Autowired
    public SchemaContextProvider(RlsGuard rlsGuard, ScopedViewCatalog catalog, HomepurseProperties properties) {
        this(rlsGuard, catalog, properties, Clock.systemDefaultZone());
    }

    SchemaContextProvider(RlsGuard rlsGuard, ScopedViewCatalog catalog, HomepurseProperties properties, Clock clock) {
        this.rlsGuard = rlsGuard;
        this.catalog = catalog;
        this.statementTimeout = properties.analysis().statementTimeout();
        this.hintLimit = properties.analysis().hintLimit();
        this.clock = clock;
    }

    public SchemaContext load(UUID householdId) {
        List<ScopedView> views = catalog.allowedViews();
        if (views.isEmpty()) {
            throw new SchemaUnavailableException("No scoped views are allow-listed");
        }
        try {
            return rlsGuard.readInHousehold(householdId, statementTimeout, connection -> {
                List<SchemaContext.ViewSchema> schemas = new ArrayList<>();
                for (ScopedView view : views) {
                    schemas.add(describe(connection, view));
                }
                SchemaContext.HouseholdHints hints = loadHints(connection, views);
                return new SchemaContext(householdId, schemas, hints, LocalDate.now(clock));
            });
        } catch (SQLException | DataAccessException ex) {
            log.warn("analysis_schema_unavailable householdId={} error={}", householdId, ex.getMessage());
            throw new SchemaUnavailableException("Could not load the analysis schema: " + ex.getMessage(), ex);
        }
    }

    private SchemaContext.ViewSchema describe(Connection connection, ScopedView view) throws SQLException {
        String sql = catalog.withClause(List.of(view)) + "SELECT * FROM " + view.name() + " LIMIT 0";
        List<SchemaContext.Column> columns = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet rs = statement.executeQuery()) {
            ResultSetMetaData meta = rs.getMetaData();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                columns.add(new SchemaContext.Column(
                        meta.getColumnLabel(i).toLowerCase(Locale.ROOT),
                        meta.getColumnTypeName(i)));
            }
        }
        if (columns.isEmpty()) {
            throw new SQLException("Scoped view " + view.name() + " exposes no columns");
        }
        return new SchemaContext.ViewSchema(view.name(), view.description(), columns);
    }

    private SchemaContext.HouseholdHints loadHints(Connection connection, List<ScopedView> views) throws SQLException {
        if (hintLimit == 0 || views.stream().noneMatch(v -> v.name().equals(ScopedViewCatalog.HOUSEHOLD_EXPENSES.name()))) {
            return SchemaContext.HouseholdHints.empty();
        }
        String prefix = catalog.withClause(List.of(ScopedViewCatalog.HOUSEHOLD_EXPENSES));
        List<String> categories = distinctValues(connection, prefix, "category");
        List<String> subcategories = distinctValues(connection, prefix, "subcategory");
        List<String> members = distinctValues(connection, prefix, "logged_by");
        List<String> merchants = distinctValues(connection, prefix, "merchant_or_item");
        String boundsSql = prefix + "SELECT MIN(date_incurred), MAX(date_incurred) FROM household_expenses";
        LocalDate first = null;
        LocalDate last = null;
        try (PreparedStatement statement = connection.prepareStatement(boundsSql);
             ResultSet rs = statement.executeQuery()) {
            if (rs.next()) {
                first = rs.getObject(1, LocalDate.class);
                last = rs.getObject(2, LocalDate.class);
            }
        }
        return new SchemaContext.HouseholdHints(categories, subcategories, members, merchants, first, last);
    }

    private List<String> distinctValues(Connection connection, String prefix, String column) throws SQLException {
        String sql = prefix
                + "SELECT DISTINCT " + column + " AS value FROM household_expenses"
                + " WHERE " + column + " IS NOT NULL AND " + column + " <> ''"
                + " ORDER BY 1 LIMIT ?";
        List<String> values = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, hintLimit);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    values.add(rs.getString(1));
                }
            }
        }
        return values;
    }
}
