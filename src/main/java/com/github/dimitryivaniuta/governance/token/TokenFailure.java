package com.github.dimitryivaniuta.governance.token;

/**
 * Machine-readable reason a token was not accepted.
 */
public enum TokenFailure {
    /** Not a parseable signed token, or required claims are missing or invalid. */
    MALFORMED,
    /** Signature does not match the process-wide secret. */
    INVALID_SIGNATURE,
    /** Past expiry (or past the refresh grace period when refreshing). */
    EXPIRED,
    /** Token id was already exchanged by a previous refresh. */
    REUSED
}
