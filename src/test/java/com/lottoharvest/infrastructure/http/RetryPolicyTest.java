package com.lottoharvest.infrastructure.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RetryPolicy.
 */
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(500), 2.0, Duration.ofSeconds(3),
        Set.of(429, 500, 502, 503, 504));

    @Test
    void testBackoffGrowsAndIsCapped() {
        assertEquals(Duration.ZERO, policy.backoffFor(0));
        assertEquals(Duration.ofMillis(500), policy.backoffFor(1));
        assertEquals(Duration.ofMillis(1000), policy.backoffFor(2));
        assertEquals(Duration.ofMillis(2000), policy.backoffFor(3));
        assertEquals(Duration.ofMillis(3000), policy.backoffFor(4));
        assertEquals(Duration.ofMillis(3000), policy.backoffFor(10));
    }

    @Test
    void testRetryableStatuses() {
        assertTrue(policy.isRetryable(503));
        assertTrue(policy.isRetryable(429));
        assertFalse(policy.isRetryable(404));
        assertFalse(policy.isRetryable(200));
    }

    @Test
    void testNoRetry() {
        RetryPolicy none = RetryPolicy.noRetry();

        assertEquals(1, none.getMaxAttempts());
        assertFalse(none.isRetryable(503));
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO, Set.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO, Set.of()));
    }
}
