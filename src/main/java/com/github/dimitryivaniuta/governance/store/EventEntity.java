package com.github.dimitryivaniuta.governance.store;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * The slice of an event the maintenance jobs read and write. The full event is owned by
 * the catalogue service.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "events")
public class EventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slug", nullable = false, length = 200)
    private String slug;

    @Column(name = "start_date", nullable = false)
    private Instant startDate;

    @Column(name = "end_date", nullable = false)
    private Instant endDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;
}
