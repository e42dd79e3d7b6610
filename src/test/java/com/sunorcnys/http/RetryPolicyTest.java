package com.sunorcnys.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void backoffDoublesUntilCap() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(Duration.ofSeconds(1), policy.rateLimitDelay(1, null));
        assertEquals(Duration.ofSeconds(2), policy.rateLimitDelay(2, null));
        assertEquals(Duration.ofSeconds(32), policy.rateLimitDelay(6, null));
        assertEquals(Duration.ofSeconds(60), policy.rateLimitDelay(7, null));
        assertEquals(Duration.ofSeconds(60), policy.rateLimitDelay(40, null));
    }

    @Test
    void hintWinsButIsCapped() {
        RetryPolicy policy = RetryPolicy.defaults();
        assertEquals(Duration.ofSeconds(3), policy.rateLimitDelay(5, Duration.ofSeconds(3)));
        assertEquals(Duration.ofSeconds(60), policy.rateLimitDelay(1, Duration.ofMinutes(10)));
    }

    @Test
    void rejectsInconsistentBounds() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1),
                1, 1, Duration.ZERO, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ZERO, Duration.ZERO,
                -1, 1, Duration.ZERO, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(Duration.ZERO, Duration.ZERO,
                1, 1, Duration.ZERO, Duration.ZERO));
    }
}
