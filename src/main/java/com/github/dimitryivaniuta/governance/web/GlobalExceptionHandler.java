package com.github.dimitryivaniuta.governance.web;

import com.github.dimitryivaniuta.governance.authz.ForbiddenException;
import com.github.dimitryivaniuta.governance.governor.AdmissionResult;
import com.github.dimitryivaniuta.governance.governor.RejectReason;
import com.github.dimitryivaniuta.governance.token.TokenException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

import static com.github.dimitryivaniuta.governance.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * @param reason machine readable cause: UNAUTHENTICATED, FORBIDDEN, RATE_LIMITED,
     *               a token failure (EXPIRED, REUSED, ...) or null for generic errors
     */
    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String reason,
            String message,
            String path,
            String correlationId
    ) {}

    @ExceptionHandler(AdmissionRejectedException.class)
    public ResponseEntity<ApiError> handleRejected(AdmissionRejectedException ex, HttpServletRequest req) {
        AdmissionResult r = ex.getResult();
        HttpStatus status = statusOf(r.reason());
        HttpHeaders h = new HttpHeaders();
        String reason = r.reason().name();

        if (r.reason() == RejectReason.RATE_LIMITED) {
            h.set(HttpHeaders.RETRY_AFTER, String.valueOf(r.retryAfterSeconds())); // seconds per RFC
            log.info("Rate limited subject={} retryAfter={}s path={}", r.subject(), r.retryAfterSeconds(), req.getRequestURI());
        } else if (r.reason() == RejectReason.UNAUTHENTICATED) {
            h.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
            if (r.tokenFailure() != null) reason = r.tokenFailure().name();
        }
        return new ResponseEntity<>(error(status, reason, r.message(), req), h, status);
    }

    @ExceptionHandler(TokenException.class)
    public ResponseEntity<ApiError> handleToken(TokenException ex, HttpServletRequest req) {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        return new ResponseEntity<>(
                error(HttpStatus.UNAUTHORIZED, ex.getFailure().name(), ex.getMessage(), req), h, HttpStatus.UNAUTHORIZED);
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiError> handleForbidden(ForbiddenException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(error(HttpStatus.FORBIDDEN, RejectReason.FORBIDDEN.name(), ex.getMessage(), req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(error(status, null, ex.getReason(), req));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(HttpStatus.BAD_REQUEST, null, "Validation failed", req));
    }

    @ExceptionHandler(org.springframework.web.servlet.resource.NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(
            org.springframework.web.servlet.resource.NoResourceFoundException ex,
            HttpServletRequest request
    ) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(error(HttpStatus.NOT_FOUND, null, ex.getMessage(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(HttpStatus.INTERNAL_SERVER_ERROR, null, "Unexpected error", req));
    }

    private static HttpStatus statusOf(RejectReason reason) {
        return switch (reason) {
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
        };
    }

    private ApiError error(HttpStatus status, String reason, String message, HttpServletRequest req) {
        return new ApiError(
                Instant.now(),
                status.value(),
                status.getReasonPhrase(),
                reason,
                (message == null || message.isBlank()) ? status.getReasonPhrase() : message,
                req.getRequestURI(),
                MDC.get(CORRELATION_ID_MDC_KEY)
        );
    }
}
