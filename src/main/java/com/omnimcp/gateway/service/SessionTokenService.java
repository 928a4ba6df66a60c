package com.omnimcp.gateway.service;

import com.omnimcp.gateway.config.GatewayProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

/**
 * Signs and verifies the time-limited tokens that carry a session id.
 */
@Component
@Slf4j
public class SessionTokenService {

    static final String SESSION_ID_CLAIM = "sessionId";
    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey signingKey;
    private final Duration expiry;
    private final Clock clock;

    public SessionTokenService(GatewayProperties properties, Clock clock) {
        this.signingKey = buildKey(properties.getJwtSecret());
        this.expiry = properties.getTokenExpiry();
        this.clock = clock;
    }

    public String generateToken(String sessionId) {
        Instant now = clock.instant();
        return Jwts.builder()
            .claim(SESSION_ID_CLAIM, sessionId)
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(expiry)))
            .signWith(signingKey)
            .compact();
    }

    /**
     * Session id carried by the token, or empty when the token is expired,
     * tampered with or malformed.
     */
    public Optional<String> validateToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
            return Optional.ofNullable(claims.get(SESSION_ID_CLAIM, String.class));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid session token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static SecretKey buildKey(String secret) {
        if (secret == null || secret.isBlank()) {
            byte[] randomBytes = new byte[64];
            new SecureRandom().nextBytes(randomBytes);
            secret = Base64.getEncoder().encodeToString(randomBytes);
            log.warn("No JWT secret configured, generated an ephemeral one (tokens won't survive restart)");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            log.warn("JWT secret is {} bytes, shorter than the {} bytes HS256 needs; padding it with zeros. "
                + "Configure a longer gateway.jwt-secret", keyBytes.length, MIN_SECRET_BYTES);
            byte[] padded = new byte[MIN_SECRET_BYTES];
            System.arraycopy(keyBytes, 0, padded, 0, keyBytes.length);
            keyBytes = padded;
        }
        return Keys.hmacShaKeyFor(keyBytes);
    }
}
