package com.github.dimitryivaniuta.governance.infra;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Timestamp;
import java.time.Instant;

@ActiveProfiles("test")
@TestPropertySource(properties = {
        "management.endpoints.web.exposure.include=health,info,metrics,prometheus",
        "management.prometheus.metrics.export.enabled=true"
})
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:16-alpine")
                    .withDatabaseName("events")
                    .withUsername("events")
                    .withPassword("events");

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired protected JdbcTemplate jdbc;

    @BeforeEach
    void cleanDatabase() {
        jdbc.execute("TRUNCATE TABLE events, users RESTART IDENTITY CASCADE");
    }

    protected void insertEvent(String slug, Instant endDate, boolean active) {
        jdbc.update("INSERT INTO events (slug, start_date, end_date, is_active) VALUES (?, ?, ?, ?)",
                slug,
                Timestamp.from(endDate.minusSeconds(3600)),
                Timestamp.from(endDate),
                active);
    }

    protected void insertAccount(String email, boolean active, String confirmationToken, Instant tokenCreated) {
        jdbc.update("INSERT INTO users (email, role, is_active, email_confirmation_token, email_confirmation_token_created) "
                        + "VALUES (?, 'user', ?, ?, ?)",
                email, active, confirmationToken, tokenCreated == null ? null : Timestamp.from(tokenCreated));
    }
}
