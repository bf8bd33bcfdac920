package com.github.dimitryivaniuta.governance.store;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Component
@RequiredArgsConstructor
public class JpaEventStore implements EventStore {

    private final EventRepository repository;

    @Override
    @Transactional
    public int deactivateEndedBefore(Instant now) {
        return repository.deactivateEndedBefore(now);
    }
}
