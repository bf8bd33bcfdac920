package com.github.dimitryivaniuta.governance.store;

import java.time.Instant;

/**
 * Account state used by maintenance jobs.
 */
public interface AccountStore {

    /**
     * Deletes accounts that were never confirmed and whose confirmation token was
     * created at or before {@code cutoff}, in a single atomic delete.
     *
     * @return number of accounts deleted
     */
    int deleteUnconfirmedCreatedBefore(Instant cutoff);
}
