package com.github.dimitryivaniuta.governance.governor;

import com.github.dimitryivaniuta.governance.authz.PermissionTable;
import com.github.dimitryivaniuta.governance.authz.RoleAuthorizer;
import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.metrics.GovernanceMetrics;
import com.github.dimitryivaniuta.governance.ratelimit.QuotaTable;
import com.github.dimitryivaniuta.governance.ratelimit.RateLimiter;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;
import com.github.dimitryivaniuta.governance.support.GovernanceFixtures;
import com.github.dimitryivaniuta.governance.support.MutableClock;
import com.github.dimitryivaniuta.governance.token.TokenFailure;
import com.github.dimitryivaniuta.governance.token.TokenService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RequestGovernorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private TokenService tokens;
    private RateLimiter rateLimiter;
    private SimpleMeterRegistry meters;
    private RequestGovernor governor;

    @BeforeEach
    void setUp() {
        GovernanceProperties p = GovernanceFixtures.defaults();
        clock = new MutableClock(T0);
        RouteClassRegistry registry = RouteClassRegistry.from(p.getRouteClasses());
        tokens = new TokenService(p, clock);
        rateLimiter = new RateLimiter(QuotaTable.from(p.getQuotas(), registry), p);
        meters = new SimpleMeterRegistry();
        governor = new RequestGovernor(
                tokens,
                new RoleAuthorizer(PermissionTable.from(p.getPermissions(), registry), registry),
                rateLimiter,
                registry,
                new GovernanceMetrics(meters));
    }

    @Test
    void shouldAdmitAnonymousOnPublicRoute() {
        AdmissionResult r = governor.admit(null, "public", "GET", "10.0.0.1", T0);

        assertThat(r.admitted()).isTrue();
        assertThat(r.role()).isEqualTo(Role.ANONYMOUS);
        assertThat(r.subject()).isEqualTo(AdmissionResult.ANONYMOUS_SUBJECT);
    }

    @Test
    void shouldAdmitVerifiedCallerWithItsRoleAndSubject() {
        String token = tokens.issue("mgr-1", Role.MANAGER).token();

        AdmissionResult r = governor.admit(token, "manager-write", "POST", "10.0.0.1", T0);

        assertThat(r.admitted()).isTrue();
        assertThat(r.role()).isEqualTo(Role.MANAGER);
        assertThat(r.subject()).isEqualTo("mgr-1");
    }

    @Test
    void expiredToken_shouldBeUnauthenticatedNotDowngraded() {
        String token = tokens.issue("user-1", Role.USER).token();

        AdmissionResult r = governor.admit(token, "public", "GET", "10.0.0.1", T0.plus(Duration.ofDays(1)));

        assertThat(r.admitted()).isFalse();
        assertThat(r.reason()).isEqualTo(RejectReason.UNAUTHENTICATED);
        assertThat(r.tokenFailure()).isEqualTo(TokenFailure.EXPIRED);
    }

    @Test
    void anonymousOnProtectedRoute_shouldBeForbidden() {
        AdmissionResult r = governor.admit(null, "user-read", "GET", "10.0.0.1", T0);

        assertThat(r.reason()).isEqualTo(RejectReason.FORBIDDEN);
    }

    @Test
    void userOnAdminRoute_shouldBeForbidden() {
        String token = tokens.issue("user-1", Role.USER).token();

        AdmissionResult r = governor.admit(token, "admin-write", "DELETE", "10.0.0.1", T0);

        assertThat(r.reason()).isEqualTo(RejectReason.FORBIDDEN);
        assertThat(r.subject()).isEqualTo("user-1");
    }

    @Test
    void invalidTokenOnUnreachableRoute_shouldBeUnauthenticatedBeforeForbidden() {
        AdmissionResult r = governor.admit("garbage", "admin-write", "DELETE", "10.0.0.1", T0);

        assertThat(r.admitted()).isFalse();
        assertThat(r.reason()).isEqualTo(RejectReason.UNAUTHENTICATED);
        assertThat(r.tokenFailure()).isEqualTo(TokenFailure.MALFORMED);
        assertThat(rateLimiter.counterCount()).isZero();
    }

    @Test
    void rejectedRequests_shouldNotConsumeQuota() {
        String userToken = tokens.issue("user-1", Role.USER).token();
        for (int i = 0; i < 50; i++) {
            governor.admit(userToken, "admin-read", "GET", "10.0.0.1", T0);
            governor.admit("garbage", "public", "GET", "10.0.0.1", T0);
        }

        assertThat(rateLimiter.counterCount()).isZero();
        assertThat(governor.admit(null, "public", "GET", "10.0.0.1", T0).admitted()).isTrue();
    }

    @Test
    void shouldRateLimitAfterAuthorizationWithRetryAfter() {
        String token = tokens.issue("user-1", Role.USER).token();
        for (int i = 0; i < 20; i++) {
            assertThat(governor.admit(token, "user-read", "GET", "10.0.0.1", T0).admitted()).isTrue();
        }

        AdmissionResult r = governor.admit(token, "user-read", "GET", "10.0.0.1", T0.plusSeconds(15));

        assertThat(r.reason()).isEqualTo(RejectReason.RATE_LIMITED);
        assertThat(r.retryAfter()).isEqualTo(Duration.ofSeconds(45));
        assertThat(r.retryAfterSeconds()).isEqualTo(45);
    }

    @Test
    void authenticatedCallers_shouldBeKeyedBySubjectNotAddress() {
        String a = tokens.issue("user-a", Role.USER).token();
        String b = tokens.issue("user-b", Role.USER).token();
        for (int i = 0; i < 20; i++) {
            governor.admit(a, "user-read", "GET", "10.0.0.1", T0);
        }

        // same address, different subject: own quota
        assertThat(governor.admit(b, "user-read", "GET", "10.0.0.1", T0).admitted()).isTrue();
        // same subject, different address: shared quota
        assertThat(governor.admit(a, "user-read", "GET", "10.9.9.9", T0).admitted()).isFalse();
    }

    @Test
    void publicRoutes_shouldBeKeyedByAddressEvenWithToken() {
        String token = tokens.issue("user-a", Role.USER).token();

        assertThat(governor.rateLimitKey(Role.USER, "user-a", "public", "10.0.0.1")).isEqualTo("ip:10.0.0.1");
        assertThat(governor.rateLimitKey(Role.USER, "user-a", "user-read", "10.0.0.1")).isEqualTo("sub:user-a");
        assertThat(governor.rateLimitKey(Role.ANONYMOUS, "anonymous", "auth", null)).isEqualTo("ip:unknown");

        for (int i = 0; i < 30; i++) {
            governor.admit(null, "public", "GET", "10.0.0.1", T0);
        }
        assertThat(governor.admit(token, "public", "GET", "10.0.0.1", T0).reason()).isEqualTo(RejectReason.RATE_LIMITED);
    }

    @Test
    void shouldCountAdmissionOutcomes() {
        governor.admit(null, "public", "GET", "10.0.0.1", T0);
        governor.admit(null, "admin-read", "GET", "10.0.0.1", T0);

        assertThat(meters.get("governance_admissions_total")
                .tag("route_class", "public").tag("outcome", "admitted").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("governance_admissions_total")
                .tag("route_class", "admin-read").tag("outcome", "forbidden").counter().count()).isEqualTo(1.0);
    }
}
