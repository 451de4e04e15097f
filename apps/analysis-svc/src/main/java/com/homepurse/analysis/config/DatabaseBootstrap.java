package com.homepurse.analysis.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies the audit schema (idempotent DDL) when the analysis tables are missing and the flag is
 * enabled. Enable with HOMEPURSE_DB_BOOTSTRAP=true.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);
    static final String SCHEMA_RESOURCE = "db/bootstrap/analysis_schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             @Value("${homepurse.db.bootstrap-enabled:false}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (homepurse.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (auditTablesExist(conn)) {
                log.info("DB bootstrap skipped: analysis_queries table already present");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA_RESOURCE);
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                try (Statement s = conn.createStatement()) {
                    s.execute(stmt);
                    applied++;
                } catch (SQLException ex) {
                    log.error("Failed executing bootstrap statement: {}", stmt, ex);
                    throw ex;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (SQLException | IOException e) {
            // The service still starts; /analysis answers DB_SCHEMA_MISSING until the DDL is applied.
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean auditTablesExist(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT to_regclass('analysis_queries') IS NOT NULL");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() && rs.getBoolean(1);
        }
    }

    private String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.strip().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    static List<String> splitStatements(String sql) {
        // The schema file has no procedural blocks, so a plain split is enough.
        return Arrays.stream(sql.split(";"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
