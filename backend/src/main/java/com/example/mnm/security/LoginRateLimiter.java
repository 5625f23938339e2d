package com.example.mnm.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-window counters of login attempts. Every attempt is charged to the client address
 * first and then to the address plus identity; either bucket running out refuses the attempt.
 * Identities are hashed into the key, and windows that have ended are swept once the table
 * grows past {@link #SWEEP_THRESHOLD} entries.
 */
@Component
public class LoginRateLimiter {

    static final int SWEEP_THRESHOLD = 10_000;

    private final int maxAttempts;
    private final int maxAttemptsPerAddress;
    private final Duration window;
    private final Clock clock;
    private final Map<String, AttemptWindow> windows = new ConcurrentHashMap<>();

    public LoginRateLimiter(
            @Value("${app.auth.rate-limit.login.per-minute:10}") int maxAttempts,
            @Value("${app.auth.rate-limit.login.per-address-per-minute:50}") int maxAttemptsPerAddress,
            Clock clock
    ) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.maxAttemptsPerAddress = Math.max(this.maxAttempts, maxAttemptsPerAddress);
        this.window = Duration.ofMinutes(1);
        this.clock = clock;
    }

    public boolean tryAcquire(String clientAddress, String identity) {
        String address = Optional.ofNullable(clientAddress).orElse("unknown").trim().toLowerCase(Locale.ROOT);
        String normalizedIdentity = Optional.ofNullable(identity).orElse("").trim().toLowerCase(Locale.ROOT);
        Instant now = clock.instant();
        sweepIfCrowded(now);

        if (!tryAcquireForKey(buildKey(address, ""), maxAttemptsPerAddress, now)) {
            return false;
        }
        if (normalizedIdentity.isEmpty()) {
            return true;
        }
        return tryAcquireForKey(buildKey(address, normalizedIdentity), maxAttempts, now);
    }

    int trackedKeys() {
        return windows.size();
    }

    private boolean tryAcquireForKey(String key, int limit, Instant now) {
        AtomicBoolean allowed = new AtomicBoolean(true);
        windows.compute(key, (k, current) -> {
            if (current == null || current.hasEnded(now, window)) {
                allowed.set(true);
                return new AttemptWindow(now, 1);
            }
            if (current.count() >= limit) {
                allowed.set(false);
                return current;
            }
            allowed.set(true);
            return new AttemptWindow(current.windowStart(), current.count() + 1);
        });
        return allowed.get();
    }

    private void sweepIfCrowded(Instant now) {
        if (windows.size() > SWEEP_THRESHOLD) {
            windows.values().removeIf(entry -> entry.hasEnded(now, window));
        }
    }

    private static String buildKey(String address, String identity) {
        return address + "|" + (identity.isEmpty() ? "*" : hash(identity));
    }

    private static String hash(String identity) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(identity.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record AttemptWindow(Instant windowStart, int count) {

        boolean hasEnded(Instant now, Duration window) {
            return !now.isBefore(windowStart.plus(window));
        }
    }
}
