package com.github.dimitryivaniuta.governance.support;

import com.github.dimitryivaniuta.governance.store.AccountStore;
import com.github.dimitryivaniuta.governance.store.EventStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Fakes of the persistence ports with the same filtering rules as the JPA queries. */
public final class InMemoryStores {
    private InMemoryStores() {}

    public static final class Event {
        public final String slug;
        public final Instant endDate;
        public boolean active;

        public Event(String slug, Instant endDate, boolean active) {
            this.slug = slug;
            this.endDate = endDate;
            this.active = active;
        }
    }

    public static final class Account {
        public final String email;
        public final boolean active;
        public final String confirmationToken;
        public final Instant confirmationTokenCreated;

        public Account(String email, boolean active, String confirmationToken, Instant confirmationTokenCreated) {
            this.email = email;
            this.active = active;
            this.confirmationToken = confirmationToken;
            this.confirmationTokenCreated = confirmationTokenCreated;
        }
    }

    public static final class Events implements EventStore {
        public final List<Event> events = new ArrayList<>();

        @Override
        public synchronized int deactivateEndedBefore(Instant now) {
            int changed = 0;
            for (Event e : events) {
                if (e.active && e.endDate.isBefore(now)) {
                    e.active = false;
                    changed++;
                }
            }
            return changed;
        }
    }

    public static final class Accounts implements AccountStore {
        public final List<Account> accounts = new ArrayList<>();

        @Override
        public synchronized int deleteUnconfirmedCreatedBefore(Instant cutoff) {
            int before = accounts.size();
            accounts.removeIf(a -> !a.active
                    && a.confirmationToken != null
                    && a.confirmationTokenCreated != null
                    && !a.confirmationTokenCreated.isAfter(cutoff));
            return before - accounts.size();
        }
    }
}
