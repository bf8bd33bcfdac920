package com.github.dimitryivaniuta.governance.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Periodically drops idle quota counters to bound memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuotaCounterEvictionJob {

    private final RateLimiter rateLimiter;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${governance.rate-limit.eviction-interval:PT1M}")
    public void evictIdleCounters() {
        int removed = rateLimiter.evictIdle(clock.instant());
        if (removed > 0) {
            log.debug("Quota counter eviction removed {} idle counters, {} remain", removed, rateLimiter.counterCount());
        }
    }
}
