package com.github.dimitryivaniuta.governance.governor;

import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.ratelimit.RateLimitDecision;
import com.github.dimitryivaniuta.governance.token.TokenFailure;

import java.time.Duration;

/**
 * Per-request governance decision.
 *
 * @param admitted     true when the handler may run
 * @param role         resolved role (ANONYMOUS without a token); null when unauthenticated
 * @param subject      verified subject id, {@link #ANONYMOUS_SUBJECT} for anonymous callers
 * @param reason       rejection reason, null when admitted
 * @param tokenFailure token problem behind an UNAUTHENTICATED rejection
 * @param retryAfter   wait time for RATE_LIMITED rejections, otherwise zero
 * @param message      human readable detail for rejections
 */
public record AdmissionResult(
        boolean admitted,
        Role role,
        String subject,
        RejectReason reason,
        TokenFailure tokenFailure,
        Duration retryAfter,
        String message
) {
    public static final String ANONYMOUS_SUBJECT = "anonymous";

    public static AdmissionResult admit(Role role, String subject) {
        return new AdmissionResult(true, role, subject, null, null, Duration.ZERO, null);
    }

    public static AdmissionResult unauthenticated(TokenFailure failure, String message) {
        return new AdmissionResult(false, null, null, RejectReason.UNAUTHENTICATED, failure, Duration.ZERO, message);
    }

    public static AdmissionResult forbidden(Role role, String subject, String message) {
        return new AdmissionResult(false, role, subject, RejectReason.FORBIDDEN, null, Duration.ZERO, message);
    }

    public static AdmissionResult rateLimited(Role role, String subject, Duration retryAfter) {
        return new AdmissionResult(false, role, subject, RejectReason.RATE_LIMITED, null, retryAfter, "Rate limit exceeded");
    }

    public boolean isAnonymous() {
        return role != null && role.isAnonymous();
    }

    public long retryAfterSeconds() {
        return RateLimitDecision.toRetryAfterSeconds(retryAfter);
    }
}
