package com.github.dimitryivaniuta.governance.core;

import java.util.Locale;

/**
 * Caller roles known to the governance layer.
 * ANONYMOUS is never carried by a token; it is assigned to requests without one.
 */
public enum Role {
    ADMIN,
    MANAGER,
    USER,
    ANONYMOUS;

    public boolean isAnonymous() {
        return this == ANONYMOUS;
    }

    /**
     * Parses the {@code role} claim of a token. Returns null for unknown values and for ANONYMOUS,
     * which must never appear in a signed token.
     */
    public static Role fromClaim(String claim) {
        if (claim == null || claim.isBlank()) return null;
        try {
            Role r = Role.valueOf(claim.trim().toUpperCase(Locale.ROOT));
            return r.isAnonymous() ? null : r;
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    public String claim() {
        return name().toLowerCase(Locale.ROOT);
    }
}
