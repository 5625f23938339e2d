package com.example.mnm.security;

import com.example.mnm.exceptions.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Mints and verifies the stateless bearer tokens. A token carries the user id as subject
 * plus issue and expiry times; nothing is stored server side.
 */
@Service
public class JwtService {
    private final SecretKey key;
    private final long expiryMinutes;
    private final Clock clock;

    public JwtService(@Value("${app.jwt.secret}") String secret,
                      @Value("${app.jwt.expiryMinutes:60}") long expiryMinutes,
                      Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiryMinutes = expiryMinutes;
        this.clock = clock;
    }

    public String generate(String userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(getExpiry())))
                .signWith(key)
                .compact();
    }

    /**
     * Returns the user id bound to {@code token}.
     *
     * @throws UnauthenticatedException if the token is missing, malformed, expired or badly signed
     */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthenticatedException("Missing bearer token");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new UnauthenticatedException("Token has no subject");
            }
            return subject;
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthenticatedException("Invalid or expired token");
        }
    }

    public Duration getExpiry() {
        return Duration.ofMinutes(expiryMinutes);
    }
}
