package com.github.dimitryivaniuta.governance.governor;

import com.github.dimitryivaniuta.governance.core.Identity;
import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.core.RouteClass;
import com.github.dimitryivaniuta.governance.metrics.GovernanceMetrics;
import com.github.dimitryivaniuta.governance.authz.RoleAuthorizer;
import com.github.dimitryivaniuta.governance.ratelimit.RateLimitDecision;
import com.github.dimitryivaniuta.governance.ratelimit.RateLimiter;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;
import com.github.dimitryivaniuta.governance.token.TokenException;
import com.github.dimitryivaniuta.governance.token.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;

/**
 * Single admission gate in front of every handler.
 *
 * Pipeline, stopping at the first failure: authenticate, authorize, rate-limit.
 * Quota is only consumed by requests that passed the first two steps, and rate-limit
 * keys are derived from the verified identity, never from a claimed one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestGovernor {

    private final TokenService tokenService;
    private final RoleAuthorizer authorizer;
    private final RateLimiter rateLimiter;
    private final RouteClassRegistry routeClasses;
    private final GovernanceMetrics metrics;

    /**
     * @param rawToken          bearer token, or null when the request carries none
     * @param routeClass        route class of the target endpoint
     * @param method            HTTP method
     * @param clientFingerprint client network identity (source address)
     * @param now               decision time
     */
    public AdmissionResult admit(String rawToken, String routeClass, String method, String clientFingerprint, Instant now) {
        AdmissionResult result = decide(rawToken, routeClass, method, clientFingerprint, now);
        metrics.admission(routeClass, result);
        return result;
    }

    private AdmissionResult decide(String rawToken, String routeClass, String method, String clientFingerprint, Instant now) {
        String m = (method == null) ? "" : method.toUpperCase(Locale.ROOT);

        // 1) authenticate
        Role role;
        String subject;
        if (rawToken == null) {
            role = Role.ANONYMOUS;
            subject = AdmissionResult.ANONYMOUS_SUBJECT;
        } else {
            try {
                Identity identity = tokenService.verify(rawToken, now);
                role = identity.role();
                subject = identity.subjectId();
            } catch (TokenException ex) {
                log.debug("Unauthenticated request routeClass={} failure={}", routeClass, ex.getFailure());
                return AdmissionResult.unauthenticated(ex.getFailure(), ex.getMessage());
            }
        }

        // 2) authorize
        if (!authorizer.isPermitted(role, routeClass, m)) {
            log.debug("Forbidden role={} subject={} routeClass={} method={}", role, subject, routeClass, m);
            return AdmissionResult.forbidden(role, subject,
                    role + " is not permitted to " + m + " on route class '" + routeClass + "'");
        }

        // 3) rate limit
        String key = rateLimitKey(role, subject, routeClass, clientFingerprint);
        RateLimitDecision decision = rateLimiter.check(key, routeClass, role, now);
        if (!decision.admitted()) {
            return AdmissionResult.rateLimited(role, subject, decision.retryAfter());
        }

        return AdmissionResult.admit(role, subject);
    }

    /**
     * Public route classes and anonymous callers are keyed by client fingerprint;
     * authenticated calls to protected route classes by subject id.
     */
    String rateLimitKey(Role role, String subject, String routeClass, String clientFingerprint) {
        boolean publicRoute = routeClasses.find(routeClass).map(RouteClass::isPublic).orElse(false);
        if (role.isAnonymous() || publicRoute) {
            String fp = (clientFingerprint == null || clientFingerprint.isBlank()) ? "unknown" : clientFingerprint;
            return "ip:" + fp;
        }
        return "sub:" + subject;
    }
}
