package com.github.dimitryivaniuta.governance.web;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.core.RouteClass;
import com.github.dimitryivaniuta.governance.governor.AdmissionResult;
import com.github.dimitryivaniuta.governance.governor.RequestGovernor;
import com.github.dimitryivaniuta.governance.route.RouteTable;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;
import java.util.Optional;

/**
 * Runs the governor before any handler. Requests to paths without a route class are
 * forbidden: every governed endpoint must be bound in {@code governance.routes}.
 */
@Slf4j
@Component
public class GovernanceInterceptor implements HandlerInterceptor {

    private final RequestGovernor governor;
    private final RouteTable routes;
    private final ClientFingerprintResolver fingerprints;
    private final Clock clock;
    private final String tokenCookie;

    public GovernanceInterceptor(RequestGovernor governor,
                                 RouteTable routes,
                                 ClientFingerprintResolver fingerprints,
                                 Clock clock,
                                 GovernanceProperties properties) {
        this.governor = governor;
        this.routes = routes;
        this.fingerprints = fingerprints;
        this.clock = clock;
        this.tokenCookie = properties.getWeb().getTokenCookie();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) return true;

        String method = request.getMethod();
        String path = request.getRequestURI().substring(request.getContextPath().length());

        Optional<RouteClass> routeClass = routes.resolve(method, path);
        if (routeClass.isEmpty()) {
            log.warn("No route class bound for {} {}", method, path);
            throw new AdmissionRejectedException(AdmissionResult.forbidden(Role.ANONYMOUS, AdmissionResult.ANONYMOUS_SUBJECT,
                    "No route class is bound to " + method + " " + path));
        }

        AdmissionResult result = governor.admit(
                BearerTokens.extract(request, tokenCookie),
                routeClass.get().name(),
                method,
                fingerprints.resolve(request),
                clock.instant());

        if (!result.admitted()) {
            throw new AdmissionRejectedException(result);
        }
        request.setAttribute(RequestContextKeys.ADMISSION_ATTRIBUTE, result);
        MDC.put(RequestContextKeys.SUBJECT_MDC_KEY, result.subject());
        return true;
    }
}
