package com.github.dimitryivaniuta.governance.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    Optional<AccountEntity> findByEmail(String email);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from AccountEntity a
            where a.active = false
              and a.emailConfirmationToken is not null
              and a.emailConfirmationTokenCreated <= :cutoff
            """)
    int deleteUnconfirmedCreatedBefore(@Param("cutoff") Instant cutoff);
}
