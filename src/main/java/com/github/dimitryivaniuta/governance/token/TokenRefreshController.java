package com.github.dimitryivaniuta.governance.token;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * Exchanges a token that is still valid, or expired within the refresh grace, for a new one.
 * The token travels in the body: an expired token in the Authorization header would be
 * rejected by admission before reaching this handler.
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class TokenRefreshController {

    private final TokenService tokenService;

    public record RefreshRequest(
            @NotBlank @Size(max = 4096) String token
    ) {}

    public record TokenResponse(
            String accessToken,
            String tokenType,
            Instant expiresAt,
            long expiresIn
    ) {}

    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshRequest req) {
        IssuedToken issued = tokenService.refresh(req.token());
        Instant expiresAt = issued.identity().expiresAt();
        return new TokenResponse(
                issued.token(),
                "Bearer",
                expiresAt,
                expiresAt.getEpochSecond() - issued.identity().issuedAt().getEpochSecond());
    }
}
