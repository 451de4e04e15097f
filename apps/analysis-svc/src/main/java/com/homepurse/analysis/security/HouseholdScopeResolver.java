package com.homepurse.analysis.security;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Resolves the household of the authenticated user from the users table owned by the
 * account-administration side of the product. The JWT subject is the user id; the household is
 * never taken from the request.
 */
@Component
public class HouseholdScopeResolver {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public HouseholdScopeResolver(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public HouseholdScope requireCurrentScope() {
        UUID userId = currentUserId().orElseThrow(() -> new IllegalStateException("user context missing"));
        List<UUID> households = jdbcTemplate.query("""
                SELECT household_id
                FROM users
                WHERE id = :userId
                  AND is_active = TRUE
                """,
                new MapSqlParameterSource("userId", userId),
                (rs, rowNum) -> rs.getObject("household_id", UUID.class));
        if (households.isEmpty() || households.get(0) == null) {
            throw new HouseholdNotFoundException(userId);
        }
        HouseholdScope scope = new HouseholdScope(households.get(0), userId);
        RequestContextHolder.bindScope(scope);
        return scope;
    }

    static Optional<UUID> currentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof JwtAuthenticationToken jwtAuthentication)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(jwtAuthentication.getName()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public static class HouseholdNotFoundException extends RuntimeException {
        public HouseholdNotFoundException(UUID userId) {
            super("No active household membership for user " + userId);
        }
    }
}
