package com.homepurse.analysis.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Verified caller identity. Only constructed server-side from an authenticated session, never
 * from request input.
 */
public record HouseholdScope(UUID householdId, UUID userId) {

    public HouseholdScope {
        Objects.requireNonNull(householdId, "householdId");
        Objects.requireNonNull(userId, "userId");
    }
}
