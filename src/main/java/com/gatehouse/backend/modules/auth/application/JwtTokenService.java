package com.gatehouse.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.gatehouse.backend.global.error.ProblemException;
import com.gatehouse.backend.global.error.ProblemKind;
import com.gatehouse.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.gatehouse.backend.modules.user.domain.AppUser;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_ORGANISATION = "organisationId";
    static final String CLAIM_ESTABLISHMENT = "establishmentId";

    private final JwtTokenProvider tokenProvider;
    private final Duration expiration;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:1h}") Duration expiration,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.expiration = expiration;
        this.clock = clock;
    }

    public SignedToken sign(AppUser user) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(expiration);

        JwtBuilder builder = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_USERNAME, user.getUsername())
                .claim(CLAIM_ROLES, user.getRoleNames());
        if (user.getOrganisationId() != null) {
            builder.claim(CLAIM_ORGANISATION, user.getOrganisationId().toString());
        }
        if (user.getEstablishmentId() != null) {
            builder.claim(CLAIM_ESTABLISHMENT, user.getEstablishmentId().toString());
        }
        String token = builder.signWith(tokenProvider.getSecretKey(), SIG.HS256).compact();

        return new SignedToken(
                token,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    /**
     * Checks signature and expiry. Any failure, including a malformed payload, is reported as
     * {@code INVALID_TOKEN}.
     */
    public SessionClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw ProblemException.unauthorized("INVALID_TOKEN", "Invalid session token");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new SessionClaims(
                    claims.getId(),
                    UUID.fromString(claims.getSubject()),
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.get(CLAIM_USERNAME, String.class),
                    roles,
                    toUuid(claims.get(CLAIM_ORGANISATION, String.class)),
                    toUuid(claims.get(CLAIM_ESTABLISHMENT, String.class)),
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException | NullPointerException e) {
            throw new ProblemException(ProblemKind.UNAUTHORIZED, "INVALID_TOKEN", "Invalid session token", e);
        }
    }

    public Duration getExpiration() {
        return expiration;
    }

    private static UUID toUuid(String value) {
        return value == null ? null : UUID.fromString(value);
    }

    public record SignedToken(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record SessionClaims(
            String tokenId,
            UUID userId,
            String email,
            String username,
            List<String> roles,
            UUID organisationId,
            UUID establishmentId,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }
}
