package com.github.dimitryivaniuta.governance.ratelimit;

import java.time.Duration;

/**
 * At most {@code max} requests per fixed {@code window}.
 */
public record QuotaLimit(long max, Duration window) {

    public QuotaLimit {
        if (max < 1) throw new IllegalArgumentException("max must be >= 1");
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static QuotaLimit perMinute(long max) {
        return new QuotaLimit(max, Duration.ofMinutes(1));
    }

    public static QuotaLimit perHour(long max) {
        return new QuotaLimit(max, Duration.ofHours(1));
    }

    @Override
    public String toString() {
        return max + "/" + window;
    }
}
