package com.github.dimitryivaniuta.governance.scheduler;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.store.AccountStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Deletes accounts left unconfirmed longer than the confirmation window (48h by default).
 */
@Component
@RequiredArgsConstructor
public class StaleAccountPurgeJob implements MaintenanceJob {

    public static final String NAME = "stale-account-purge";

    private final AccountStore accounts;
    private final GovernanceProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String schedule() {
        return properties.getScheduler().getStaleAccountPurge().getCron();
    }

    @Override
    public int run(Instant now) {
        Instant cutoff = now.minus(properties.getScheduler().getUnconfirmedAccountTtl());
        return accounts.deleteUnconfirmedCreatedBefore(cutoff);
    }
}
