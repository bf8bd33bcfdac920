package com.github.dimitryivaniuta.governance.token;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.GovernanceConfigurationException;
import com.github.dimitryivaniuta.governance.core.Identity;
import com.github.dimitryivaniuta.governance.core.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import io.jsonwebtoken.security.WeakKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * Issues, verifies and refreshes HS256-signed identity tokens.
 *
 * Verification depends only on the token, the clock and the process-wide secret; it never
 * touches storage. Refresh additionally remembers consumed token ids in a local Caffeine
 * cache, bounded by ttl + refresh grace, so that one token cannot be refreshed twice.
 */
@Slf4j
@Service
public class TokenService {

    static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;
    private final String issuer;
    private final Duration ttl;
    private final Duration refreshGrace;
    private final Clock clock;
    private final Cache<String, Boolean> consumedTokenIds;

    public TokenService(GovernanceProperties properties, Clock clock) {
        GovernanceProperties.Token cfg = properties.getToken();
        if (cfg.getSecret() == null || cfg.getSecret().isBlank()) {
            throw new GovernanceConfigurationException("governance.token.secret must be set");
        }
        try {
            this.signingKey = Keys.hmacShaKeyFor(cfg.getSecret().getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException ex) {
            throw new GovernanceConfigurationException("governance.token.secret must be at least 256 bits (32 bytes)");
        }
        if (cfg.getTtl().isNegative() || cfg.getTtl().isZero()) {
            throw new GovernanceConfigurationException("governance.token.ttl must be positive");
        }
        if (cfg.getRefreshGrace().isNegative()) {
            throw new GovernanceConfigurationException("governance.token.refresh-grace must not be negative");
        }
        this.issuer = cfg.getIssuer();
        this.ttl = cfg.getTtl();
        this.refreshGrace = cfg.getRefreshGrace();
        this.clock = clock;
        // expiry only, no size bound: an id evicted early could be refreshed a second time
        this.consumedTokenIds = Caffeine.newBuilder()
                .expireAfterWrite(ttl.plus(refreshGrace))
                .build();
    }

    public IssuedToken issue(String subjectId, Role role) {
        return issue(subjectId, role, clock.instant());
    }

    /**
     * Signs a new identity for the subject. Issue and expiry instants are truncated to
     * seconds so that verification returns exactly the identity that was issued.
     */
    public IssuedToken issue(String subjectId, Role role, Instant now) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        if (role == null || role.isAnonymous()) {
            throw new IllegalArgumentException("tokens are issued for ADMIN, MANAGER or USER only");
        }

        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Identity identity = new Identity(subjectId, role, issuedAt, issuedAt.plus(ttl), UUID.randomUUID().toString());

        String token = Jwts.builder()
                .id(identity.tokenId())
                .subject(identity.subjectId())
                .issuer(issuer)
                .claim(ROLE_CLAIM, role.claim())
                .issuedAt(Date.from(identity.issuedAt()))
                .expiration(Date.from(identity.expiresAt()))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();

        return new IssuedToken(token, identity);
    }

    public Identity verify(String token) {
        return verify(token, clock.instant());
    }

    /**
     * @throws TokenException MALFORMED, INVALID_SIGNATURE or EXPIRED
     */
    public Identity verify(String token, Instant now) {
        Identity identity = toIdentity(parse(token, now, false));
        if (identity.isExpiredAt(now)) {
            throw new TokenException(TokenFailure.EXPIRED, "Token expired at " + identity.expiresAt());
        }
        return identity;
    }

    public IssuedToken refresh(String token) {
        return refresh(token, clock.instant());
    }

    /**
     * Exchanges a validly signed token for a new one with the same subject and role.
     * The input may be expired by less than the refresh grace period. Its token id is
     * consumed: a second refresh of the same token fails with REUSED.
     *
     * @throws TokenException MALFORMED, INVALID_SIGNATURE, EXPIRED or REUSED
     */
    public IssuedToken refresh(String token, Instant now) {
        Identity old = toIdentity(parse(token, now, true));

        if (!now.isBefore(old.expiresAt().plus(refreshGrace))) {
            throw new TokenException(TokenFailure.EXPIRED,
                    "Token expired at " + old.expiresAt() + " and is past the refresh grace period");
        }
        if (consumedTokenIds.asMap().putIfAbsent(old.tokenId(), Boolean.TRUE) != null) {
            log.warn("Refresh rejected: token id {} of subject {} was already refreshed", old.tokenId(), old.subjectId());
            throw new TokenException(TokenFailure.REUSED, "Token was already refreshed");
        }

        IssuedToken fresh = issue(old.subjectId(), old.role(), now);
        log.debug("Refreshed token for subject={} oldTokenId={} newTokenId={}",
                old.subjectId(), old.tokenId(), fresh.identity().tokenId());
        return fresh;
    }

    public Duration getTtl() {
        return ttl;
    }

    private Claims parse(String token, Instant now, boolean allowExpired) {
        if (token == null || token.isBlank()) {
            throw new TokenException(TokenFailure.MALFORMED, "Token is empty");
        }
        try {
            return Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token.trim())
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            // signature has already been verified when expiry is evaluated
            if (allowExpired) {
                return ex.getClaims();
            }
            throw new TokenException(TokenFailure.EXPIRED, "Token expired", ex);
        } catch (SignatureException ex) {
            throw new TokenException(TokenFailure.INVALID_SIGNATURE, "Token signature does not match", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new TokenException(TokenFailure.MALFORMED, "Token cannot be parsed: " + ex.getMessage(), ex);
        }
    }

    private Identity toIdentity(Claims claims) {
        try {
            if (issuer != null && !issuer.equals(claims.getIssuer())) {
                throw new TokenException(TokenFailure.MALFORMED, "Unexpected token issuer");
            }
            String subject = claims.getSubject();
            Role role = Role.fromClaim(claims.get(ROLE_CLAIM, String.class));
            String tokenId = claims.getId();
            Date iat = claims.getIssuedAt();
            Date exp = claims.getExpiration();

            if (subject == null || subject.isBlank() || role == null || tokenId == null || iat == null || exp == null) {
                throw new TokenException(TokenFailure.MALFORMED, "Token is missing required claims");
            }
            return new Identity(subject, role, iat.toInstant(), exp.toInstant(), tokenId);
        } catch (JwtException ex) {
            throw new TokenException(TokenFailure.MALFORMED, "Token claims are invalid: " + ex.getMessage(), ex);
        }
    }
}
