package com.github.dimitryivaniuta.governance.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Authenticated subject extracted from a verified token.
 *
 * @param subjectId the account id the token was issued for
 * @param role      the account role at issue time
 * @param issuedAt  issue instant (second precision)
 * @param expiresAt expiry instant (second precision)
 * @param tokenId   unique token id ({@code jti})
 */
public record Identity(
        String subjectId,
        Role role,
        Instant issuedAt,
        Instant expiresAt,
        String tokenId
) {
    public Identity {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        Objects.requireNonNull(tokenId, "tokenId must not be null");
    }

    /** An identity is expired from its expiry instant onwards. */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
