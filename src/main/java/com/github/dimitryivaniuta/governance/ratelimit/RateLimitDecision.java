package com.github.dimitryivaniuta.governance.ratelimit;

import java.time.Duration;

/**
 * Outcome of a quota check.
 *
 * @param admitted   whether the request fits in every applicable window
 * @param count      requests counted in the deciding window, this one included (0 when unlimited)
 * @param remaining  requests left in the deciding window
 * @param retryAfter time until the rejecting window rolls over; {@link Duration#ZERO} when admitted
 */
public record RateLimitDecision(boolean admitted, long count, long remaining, Duration retryAfter) {

    public static RateLimitDecision admit(long count, long remaining) {
        return new RateLimitDecision(true, count, remaining, Duration.ZERO);
    }

    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, 0L, Long.MAX_VALUE, Duration.ZERO);
    }

    public static RateLimitDecision limited(long count, Duration retryAfter) {
        return new RateLimitDecision(false, count, 0L, retryAfter);
    }

    public long retryAfterSeconds() {
        return toRetryAfterSeconds(retryAfter);
    }

    /** Whole seconds for a {@code Retry-After} header, rounded up and never below 1. */
    public static long toRetryAfterSeconds(Duration wait) {
        long s = wait.getSeconds() + (wait.getNano() > 0 ? 1 : 0);
        return Math.max(1L, s);
    }
}
