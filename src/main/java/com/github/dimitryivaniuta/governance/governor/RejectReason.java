package com.github.dimitryivaniuta.governance.governor;

/**
 * Why a request was not admitted. Transport layers map these to 401, 403 and 429.
 */
public enum RejectReason {
    UNAUTHENTICATED,
    FORBIDDEN,
    RATE_LIMITED
}
