package com.github.dimitryivaniuta.governance.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface EventRepository extends JpaRepository<EventEntity, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update EventEntity e
            set e.active = false
            where e.active = true and e.endDate < :now
            """)
    int deactivateEndedBefore(@Param("now") Instant now);
}
