package com.homepurse.analysis.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseBootstrapTest {

    @Test
    void splitsOnSemicolonsAndDropsBlankStatements() {
        List<String> statements = DatabaseBootstrap.splitStatements("""
                CREATE TABLE a (id uuid);

                CREATE INDEX a_idx ON a (id);
                ;
                """);
        assertEquals(List.of("CREATE TABLE a (id uuid)", "CREATE INDEX a_idx ON a (id)"), statements);
    }
}
