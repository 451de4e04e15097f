package com.homepurse.analysis.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

@ExtendWith(MockitoExtension.class)
class HouseholdScopeResolverTest {

    private static final UUID USER_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID HOUSEHOLD_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Mock
    NamedParameterJdbcTemplate jdbcTemplate;

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
        RequestContextHolder.clear();
    }

    private static void authenticateAs(String subject) {
        Jwt jwt = Jwt.withTokenValue("token")
                .header("alg", "HS256")
                .subject(subject)
                .issuedAt(Instant.parse("2024-06-15T08:00:00Z"))
                .expiresAt(Instant.parse("2024-06-15T09:00:00Z"))
                .build();
        SecurityContextHolder.getContext().setAuthentication(new JwtAuthenticationToken(jwt));
    }

    @Test
    @SuppressWarnings("unchecked")
    void resolvesHouseholdOfTokenSubjectAndBindsIt() {
        authenticateAs(USER_ID.toString());
        RequestContextHolder.begin("trace-1");
        when(jdbcTemplate.query(anyString(), any(MapSqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of(HOUSEHOLD_ID));

        HouseholdScope scope = new HouseholdScopeResolver(jdbcTemplate).requireCurrentScope();

        assertThat(scope).isEqualTo(new HouseholdScope(HOUSEHOLD_ID, USER_ID));
        assertThat(RequestContextHolder.scope()).contains(scope);
        assertThat(RequestContextHolder.traceId()).contains("trace-1");
    }

    @Test
    @SuppressWarnings("unchecked")
    void userWithoutActiveHouseholdIsRefused() {
        authenticateAs(USER_ID.toString());
        when(jdbcTemplate.query(anyString(), any(MapSqlParameterSource.class), any(RowMapper.class)))
                .thenReturn(List.of());

        assertThatThrownBy(() -> new HouseholdScopeResolver(jdbcTemplate).requireCurrentScope())
                .isInstanceOf(HouseholdScopeResolver.HouseholdNotFoundException.class)
                .hasMessageContaining(USER_ID.toString());
        assertThat(RequestContextHolder.scope()).isEmpty();
    }

    @Test
    void subjectThatIsNotAUserIdNeverReachesTheDatabase() {
        authenticateAs("not-a-uuid");

        assertThatThrownBy(() -> new HouseholdScopeResolver(jdbcTemplate).requireCurrentScope())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("user context missing");
        verifyNoInteractions(jdbcTemplate);
    }
}
