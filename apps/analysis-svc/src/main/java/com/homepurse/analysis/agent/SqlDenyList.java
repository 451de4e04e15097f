package com.homepurse.analysis.agent;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Functions, schemas and keywords a generated query may never use. Names are lower case.
 */
public final class SqlDenyList {

    static final Set<String> FUNCTIONS = Set.of(
            // session and configuration
            "current_setting", "set_config",
            // sequences mutate state even inside SELECT
            "nextval", "setval", "currval", "lastval",
            // catalog and server introspection
            "version", "current_database", "current_schema", "current_schemas",
            "inet_server_addr", "inet_server_port", "inet_client_addr", "inet_client_port",
            "has_table_privilege", "has_schema_privilege", "has_database_privilege",
            "has_column_privilege", "has_function_privilege", "row_security_active",
            "to_regclass", "to_regtype", "to_regproc", "to_regnamespace", "txid_current",
            // query execution through functions
            "query_to_xml", "query_to_xml_and_xmlschema", "query_to_xmlschema",
            "table_to_xml", "table_to_xmlschema", "cursor_to_xml",
            "schema_to_xml", "database_to_xml"
    );

    static final List<String> FUNCTION_PREFIXES = List.of("pg_", "lo_", "dblink");

    static final Set<String> SCHEMAS = Set.of("pg_catalog", "information_schema", "pg_toast", "pg_temp");

    private static final List<RawRule> RAW_RULES = List.of(
            new RawRule("write or DDL keyword", Pattern.compile(
                    "\\b(insert|update|delete|merge|upsert|drop|alter|truncate|create|grant|revoke|copy|execute"
                            + "|vacuum|reindex|attach|detach|pragma)\\b")),
            new RawRule("TABLE statement", Pattern.compile(
                    "\\b(table)\\s+(only\\s+)?[\"a-z_]")),
            new RawRule("row-locking clause", Pattern.compile(
                    "\\bfor\\s+(no\\s+key\\s+update|update|key\\s+share|share)\\b")),
            new RawRule("system catalog", Pattern.compile(
                    "\\b(pg_catalog|information_schema|pg_toast|sqlite_master)\\b")),
            new RawRule("denied function", Pattern.compile(
                    "\\b(" + FUNCTIONS.stream().sorted().collect(Collectors.joining("|")) + ")\"?\\s*\\(")),
            new RawRule("denied function", Pattern.compile(
                    "\\b(pg_\\w*|lo_\\w*|dblink\\w*)\"?\\s*\\("))
    );

    private SqlDenyList() {
    }

    public static boolean isDeniedFunction(String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        if (FUNCTIONS.contains(normalized)) {
            return true;
        }
        return FUNCTION_PREFIXES.stream().anyMatch(normalized::startsWith);
    }

    public static boolean isDeniedSchema(String schema) {
        return schema != null && SCHEMAS.contains(schema.toLowerCase(Locale.ROOT));
    }

    /**
     * Scans raw SQL text, comments and literals included, and names the first match.
     */
    public static Optional<String> scanRawText(String sql) {
        String text = sql.toLowerCase(Locale.ROOT);
        for (RawRule rule : RAW_RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find()) {
                return Optional.of("Forbidden " + rule.label() + " '" + matcher.group(1) + "' found in SQL text");
            }
        }
        return Optional.empty();
    }

    private record RawRule(String label, Pattern pattern) {
    }
}
