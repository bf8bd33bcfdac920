package com.github.dimitryivaniuta.governance.store;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "users")
public class AccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    /** admin / manager / user */
    @Column(name = "role", nullable = false, length = 16)
    private String role;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    /** Set on self-registration, cleared once the address is confirmed. */
    @Column(name = "email_confirmation_token", length = 128)
    private String emailConfirmationToken;

    @Column(name = "email_confirmation_token_created")
    private Instant emailConfirmationTokenCreated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
