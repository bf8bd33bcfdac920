package com.github.dimitryivaniuta.governance.store;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Component
@RequiredArgsConstructor
public class JpaAccountStore implements AccountStore {

    private final AccountRepository repository;

    @Override
    @Transactional
    public int deleteUnconfirmedCreatedBefore(Instant cutoff) {
        return repository.deleteUnconfirmedCreatedBefore(cutoff);
    }
}
