package com.github.dimitryivaniuta.governance.scheduler;

import java.time.Instant;

/**
 * Idempotent time-driven maintenance task: running it twice at the same instant
 * leaves the same end state as running it once.
 */
public interface MaintenanceJob {

    String name();

    /** Cron expression, for job records. */
    String schedule();

    /**
     * Applies the state transition for {@code now} through the persistence collaborator.
     *
     * @return number of documents changed
     */
    int run(Instant now);
}
