package com.homepurse.analysis.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.homepurse.analysis.security.RlsGuard;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScopedQueryExecutorTest {

    @Mock
    RlsGuard rlsGuard;
    @Mock
    Connection connection;
    @Mock
    PreparedStatement statement;
    @Mock
    ResultSet resultSet;
    @Mock
    ResultSetMetaData metaData;

    ExecutorService pool;
    ScopedQueryExecutor executor;

    @BeforeEach
    void setUp() {
        pool = Executors.newSingleThreadExecutor();
        var properties = AgentFixtures.properties();
        executor = new ScopedQueryExecutor(rlsGuard, new ScopedViewCatalog(properties), properties, pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @SuppressWarnings("unchecked")
    private void guardRunsWorkOnConnection() throws SQLException {
        when(rlsGuard.readInHousehold(eq(AgentFixtures.HOUSEHOLD_ID), eq(Duration.ofSeconds(5)), any()))
                .thenAnswer(invocation -> ((RlsGuard.ScopedWork<Object>) invocation.getArgument(2)).run(connection));
    }

    @Test
    void wrapsQueryInScopedViewsAndNormalizesCells() throws Exception {
        guardRunsWorkOnConnection();
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(3);
        when(metaData.getColumnLabel(1)).thenReturn("category");
        when(metaData.getColumnLabel(2)).thenReturn("total");
        when(metaData.getColumnLabel(3)).thenReturn("last_day");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn(null);
        when(resultSet.getObject(2)).thenReturn(new BigDecimal("12.50"));
        when(resultSet.getObject(3)).thenReturn(Date.valueOf(LocalDate.of(2024, 5, 31)));

        QueryResult result = executor.execute("SELECT category, SUM(amount) AS total FROM household_expenses GROUP BY 1",
                        Set.of("household_expenses"), AgentFixtures.HOUSEHOLD_ID)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.columns()).containsExactly("category", "total", "last_day");
        assertThat(result.rows()).containsExactly(List.of("", 12.5, "2024-05-31"));

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertThat(sql.getValue())
                .startsWith("WITH household_expenses AS (")
                .contains("household_categories AS (")
                .contains("current_setting('app.household_id', true)")
                .endsWith(") AS agent_result LIMIT 200");
        verify(statement).setQueryTimeout(5);
        verify(statement).setMaxRows(200);
    }

    @Test
    void databaseErrorBecomesExecutionFailureWithLiteralMessage() throws Exception {
        guardRunsWorkOnConnection();
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenThrow(new SQLException("ERROR: column \"amout\" does not exist"));

        assertThatThrownBy(() -> executor.execute("SELECT amout FROM household_expenses",
                        Set.of("household_expenses"), AgentFixtures.HOUSEHOLD_ID)
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(QueryExecutionException.class)
                .hasMessage("ERROR: column \"amout\" does not exist");
    }

    @Test
    void refusesRelationsOutsideTheScopedViews() {
        assertThatThrownBy(() -> executor.execute("SELECT * FROM users", Set.of("users"), AgentFixtures.HOUSEHOLD_ID)
                .get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(QueryExecutionException.class);
        verifyNoInteractions(rlsGuard);
    }

    @Test
    void normalizesScalarTypes() {
        assertThat(ScopedQueryExecutor.normalize(null)).isEqualTo("");
        assertThat(ScopedQueryExecutor.normalize(Boolean.TRUE)).isEqualTo("true");
        assertThat(ScopedQueryExecutor.normalize(7L)).isEqualTo(7L);
        assertThat(ScopedQueryExecutor.normalize(1.5f)).isEqualTo(1.5d);
        assertThat(ScopedQueryExecutor.normalize("Costco")).isEqualTo("Costco");
    }
}
