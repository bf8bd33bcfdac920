package com.github.dimitryivaniuta.governance.core;

public enum RouteAccess {
    /** Reachable without a token; rate limited by client fingerprint. */
    PUBLIC,
    /** Requires a verified identity; rate limited by subject id. */
    AUTHENTICATED
}
