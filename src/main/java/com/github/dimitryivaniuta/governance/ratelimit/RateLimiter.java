package com.github.dimitryivaniuta.governance.ratelimit;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-window request quotas per (key, route class, window).
 *
 * Locking: every counter update runs inside {@link ConcurrentHashMap#compute}, which
 * serializes writers of the same key (per-bin lock) while different keys proceed in
 * parallel. Counters are immutable snapshots, so a reader never observes a half-applied
 * update. Eviction uses {@code computeIfPresent} under the same lock.
 */
@Slf4j
@Service
public class RateLimiter {

    private final QuotaTable quotas;
    private final Duration evictionGrace;

    private final ConcurrentHashMap<CounterKey, QuotaCounter> counters = new ConcurrentHashMap<>();

    public RateLimiter(QuotaTable quotas, GovernanceProperties properties) {
        this.quotas = quotas;
        this.evictionGrace = properties.getRateLimit().getEvictionGrace();
    }

    /**
     * Counts one request against every limit that applies to (routeClass, role).
     * Limits are evaluated in declared order and all must pass; a limit that rejects
     * stops evaluation, so later windows are not charged for a rejected request.
     */
    public RateLimitDecision check(String key, String routeClass, Role role, Instant now) {
        List<QuotaLimit> limits = quotas.limitsFor(routeClass, role);
        if (limits.isEmpty()) {
            return RateLimitDecision.unlimited();
        }

        RateLimitDecision deciding = null;
        for (QuotaLimit limit : limits) {
            RateLimitDecision d = hit(new CounterKey(key, routeClass, limit), now);
            if (!d.admitted()) {
                log.debug("Rate limit hit key={} routeClass={} limit={} retryAfter={}", key, routeClass, limit, d.retryAfter());
                return d;
            }
            if (deciding == null || d.remaining() < deciding.remaining()) {
                deciding = d;
            }
        }
        return deciding;
    }

    private RateLimitDecision hit(CounterKey ck, Instant now) {
        QuotaLimit limit = ck.limit();
        QuotaCounter c = counters.compute(ck, (k, prev) -> QuotaCounter.next(prev, now, limit.window()));

        if (c.count() > limit.max()) {
            Duration retryAfter = Duration.between(now, c.windowStart().plus(limit.window()));
            return RateLimitDecision.limited(c.count(), retryAfter);
        }
        return RateLimitDecision.admit(c.count(), limit.max() - c.count());
    }

    /**
     * Drops counters whose window expired more than the grace period ago.
     *
     * @return number of counters removed
     */
    public int evictIdle(Instant now) {
        AtomicInteger removed = new AtomicInteger();
        for (CounterKey key : counters.keySet()) {
            Duration window = key.limit().window();
            Duration grace = (evictionGrace != null) ? evictionGrace : window;
            counters.computeIfPresent(key, (k, c) -> {
                if (!now.isBefore(c.windowStart().plus(window).plus(grace))) {
                    removed.incrementAndGet();
                    return null;
                }
                return c;
            });
        }
        return removed.get();
    }

    public int counterCount() {
        return counters.size();
    }

    private record CounterKey(String key, String routeClass, QuotaLimit limit) {}

    /**
     * Immutable counter state. The window start never moves backwards: a timestamp
     * earlier than the current window start is counted in the current window.
     */
    private record QuotaCounter(long count, Instant windowStart) {

        static QuotaCounter next(QuotaCounter prev, Instant now, Duration window) {
            if (prev == null || !now.isBefore(prev.windowStart.plus(window))) {
                // rollover: now is at or past the previous window's end
                return new QuotaCounter(1, now);
            }
            return new QuotaCounter(prev.count + 1, prev.windowStart);
        }
    }
}
