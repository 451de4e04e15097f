package com.homepurse.analysis.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RlsGuardTest {

    private static final UUID HOUSEHOLD_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Mock
    DataSource dataSource;
    @Mock
    Connection connection;
    @Mock
    Statement statement;
    @Mock
    PreparedStatement scope;

    private void connectionAvailable() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.prepareStatement("SELECT set_config('app.household_id', ?, true)")).thenReturn(scope);
    }

    @Test
    void bindsHouseholdInReadOnlyTransactionAndRollsBack() throws Exception {
        connectionAvailable();
        RlsGuard guard = new RlsGuard(dataSource);

        String value = guard.readInHousehold(HOUSEHOLD_ID, Duration.ofSeconds(5), c -> "done");

        assertThat(value).isEqualTo("done");
        InOrder order = inOrder(connection, statement, scope);
        order.verify(connection).setReadOnly(true);
        order.verify(connection).setAutoCommit(false);
        order.verify(statement).execute("SET TRANSACTION READ ONLY");
        order.verify(statement).execute("SET LOCAL statement_timeout = 5000");
        order.verify(scope).setString(1, HOUSEHOLD_ID.toString());
        order.verify(scope).execute();
        order.verify(connection).rollback();
        order.verify(connection).close();
    }

    @Test
    void rollsBackWhenWorkFails() throws Exception {
        connectionAvailable();
        RlsGuard guard = new RlsGuard(dataSource);

        assertThatThrownBy(() -> guard.readInHousehold(HOUSEHOLD_ID, Duration.ofSeconds(5), c -> {
            throw new SQLException("relation does not exist");
        })).isInstanceOf(SQLException.class).hasMessage("relation does not exist");
        verify(connection).rollback();
    }

    @Test
    void requiresHousehold() {
        RlsGuard guard = new RlsGuard(dataSource);

        assertThatThrownBy(() -> guard.readInHousehold(null, Duration.ofSeconds(5), c -> "x"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(dataSource);
    }
}
