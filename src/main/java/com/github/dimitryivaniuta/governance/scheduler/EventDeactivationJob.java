package com.github.dimitryivaniuta.governance.scheduler;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.store.EventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Deactivates events whose end time has passed. Events already inactive are not
 * selected, so a second run on the same day changes nothing.
 */
@Component
@RequiredArgsConstructor
public class EventDeactivationJob implements MaintenanceJob {

    public static final String NAME = "event-deactivation";

    private final EventStore events;
    private final GovernanceProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String schedule() {
        return properties.getScheduler().getEventDeactivation().getCron();
    }

    @Override
    public int run(Instant now) {
        return events.deactivateEndedBefore(now);
    }
}
