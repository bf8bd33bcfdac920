package com.github.dimitryivaniuta.governance.config;

import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.core.RouteAccess;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Static governance configuration: token settings, route classes, route bindings,
 * permission and quota tables, and maintenance scheduling.
 * Read once at startup; the tables built from it are immutable.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {

    @Valid
    private Token token = new Token();

    @Valid
    private List<RouteClassDef> routeClasses = new ArrayList<>();

    @Valid
    private List<RouteDef> routes = new ArrayList<>();

    @Valid
    private List<PermissionDef> permissions = new ArrayList<>();

    @Valid
    private List<QuotaDef> quotas = new ArrayList<>();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Web web = new Web();

    @Getter
    @Setter
    public static class Token {
        /** HMAC secret, at least 32 bytes of UTF-8. */
        @NotBlank
        private String secret;
        private String issuer = "events-api";
        @NotNull
        private Duration ttl = Duration.ofDays(1);
        /** How long after expiry a token may still be exchanged for a fresh one. */
        @NotNull
        private Duration refreshGrace = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class RouteClassDef {
        @NotBlank
        private String name;
        @NotNull
        private RouteAccess access = RouteAccess.AUTHENTICATED;
    }

    @Getter
    @Setter
    public static class RouteDef {
        @NotBlank
        private String pattern;
        // empty = every method
        private List<String> methods = new ArrayList<>();
        @NotBlank
        private String routeClass;
    }

    @Getter
    @Setter
    public static class PermissionDef {
        @NotNull
        private Role role;
        @NotEmpty
        private List<String> routeClasses = new ArrayList<>();
        // empty = every method
        private List<String> methods = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class QuotaDef {
        // null = any route class
        private String routeClass;
        // null = any role
        private Role role;
        @Valid
        @NotEmpty
        private List<LimitDef> limits = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class LimitDef {
        @Min(1)
        private long max;
        @NotNull
        private Duration window;
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Idle time past window expiry before a counter is dropped; null = one window. */
        private Duration evictionGrace;
        @NotNull
        private Duration evictionInterval = Duration.ofMinutes(1);
    }

    @Getter
    @Setter
    public static class Scheduler {
        @NotBlank
        private String zone = "Asia/Jerusalem";
        @NotNull
        private Duration maxRunDuration = Duration.ofMinutes(5);
        private boolean runOnStartup = false;
        @Valid
        private Job eventDeactivation = new Job();
        @Valid
        private Job staleAccountPurge = new Job();
        @NotNull
        private Duration unconfirmedAccountTtl = Duration.ofHours(48);
    }

    @Getter
    @Setter
    public static class Job {
        @NotBlank
        private String cron = "0 0 0 * * *";
    }

    @Getter
    @Setter
    public static class Web {
        private List<String> ungovernedPaths = new ArrayList<>(List.of("/actuator/**", "/error"));
        private String tokenCookie = "token";
        private boolean trustForwardedHeaders = false;
    }
}
