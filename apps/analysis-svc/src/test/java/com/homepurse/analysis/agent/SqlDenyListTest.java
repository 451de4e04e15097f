package com.homepurse.analysis.agent;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SqlDenyListTest {

    @Test
    void deniesNamedFunctionsAndPrefixes() {
        assertThat(SqlDenyList.isDeniedFunction("current_setting")).isTrue();
        assertThat(SqlDenyList.isDeniedFunction("PG_READ_FILE")).isTrue();
        assertThat(SqlDenyList.isDeniedFunction("lo_import")).isTrue();
        assertThat(SqlDenyList.isDeniedFunction("dblink_connect")).isTrue();
        assertThat(SqlDenyList.isDeniedFunction("sum")).isFalse();
        assertThat(SqlDenyList.isDeniedFunction("date_trunc")).isFalse();
    }

    @Test
    void deniesCatalogSchemas() {
        assertThat(SqlDenyList.isDeniedSchema("information_schema")).isTrue();
        assertThat(SqlDenyList.isDeniedSchema("Pg_Catalog")).isTrue();
        assertThat(SqlDenyList.isDeniedSchema("public")).isFalse();
    }

    @Test
    void rawScanUsesWordBoundaries() {
        assertThat(SqlDenyList.scanRawText("SELECT created_at, updated_at FROM household_expenses")).isEmpty();
        assertThat(SqlDenyList.scanRawText("SELECT 1 FROM x FOR SHARE")).isPresent();
        assertThat(SqlDenyList.scanRawText("select pg_sleep (5)")).hasValueSatisfying(
                reason -> assertThat(reason).contains("pg_sleep"));
        assertThat(SqlDenyList.scanRawText("SELECT * FROM information_schema.tables")).hasValueSatisfying(
                reason -> assertThat(reason).contains("information_schema"));
    }

    @Test
    void rawScanRejectsBareTableStatement() {
        assertThat(SqlDenyList.scanRawText("SELECT amount FROM household_expenses WHERE amount > (TABLE users)"))
                .hasValueSatisfying(reason -> assertThat(reason).contains("TABLE statement"));
        assertThat(SqlDenyList.scanRawText("SELECT category FROM household_categories")).isEmpty();
    }
}
