package com.github.dimitryivaniuta.governance.store;

import java.time.Instant;

/**
 * Event state used by maintenance jobs.
 */
public interface EventStore {

    /**
     * Clears the active flag of every active event that ended before {@code now},
     * in a single atomic update.
     *
     * @return number of events deactivated
     */
    int deactivateEndedBefore(Instant now);
}
