package com.example.mnm.security;

import com.example.mnm.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LoginRateLimiterTest {

    private static final String CLIENT_IP = "203.0.113.10";

    private final MutableClock clock = new MutableClock(Instant.EPOCH);
    private final LoginRateLimiter limiter = new LoginRateLimiter(3, 5, clock);

    @Test
    void attemptsBeyondTheLimitAreRefusedUntilTheWindowEnds() {
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire(CLIENT_IP, "ana@example.com")).isTrue();
        }
        assertThat(limiter.tryAcquire(CLIENT_IP, "ana@example.com")).isFalse();

        clock.advanceSeconds(60);

        assertThat(limiter.tryAcquire(CLIENT_IP, "ana@example.com")).isTrue();
    }

    @Test
    void limitIsKeptPerAddressAndIdentity() {
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire(CLIENT_IP, "ana@example.com");
        }

        assertThat(limiter.tryAcquire(CLIENT_IP, "bia@example.com")).isTrue();
        assertThat(limiter.tryAcquire("198.51.100.7", "ana@example.com")).isTrue();
    }

    @Test
    void oneAddressCannotSprayDistinctIdentities() {
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.tryAcquire(CLIENT_IP, "user" + i + "@example.com")).isTrue();
        }

        assertThat(limiter.tryAcquire(CLIENT_IP, "user99@example.com")).isFalse();
        assertThat(limiter.tryAcquire("198.51.100.7", "user99@example.com")).isTrue();
    }

    @Test
    void endedWindowsAreSweptOnceTheTableIsCrowded() {
        LoginRateLimiter roomy = new LoginRateLimiter(3, 3, clock);
        for (int i = 0; i <= LoginRateLimiter.SWEEP_THRESHOLD; i++) {
            roomy.tryAcquire("10.0." + (i / 256) + "." + (i % 256), "");
        }
        assertThat(roomy.trackedKeys()).isGreaterThan(LoginRateLimiter.SWEEP_THRESHOLD);

        clock.advanceSeconds(60);
        roomy.tryAcquire(CLIENT_IP, "ana@example.com");

        assertThat(roomy.trackedKeys()).isEqualTo(2);
    }
}
