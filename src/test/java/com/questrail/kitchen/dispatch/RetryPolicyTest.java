package com.questrail.kitchen.dispatch;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultsAreFourAttemptsWithDoublingBackoff() {
        RetryPolicy p = RetryPolicy.defaults();

        assertEquals(4, p.maxAttempts());
        assertEquals(Duration.ofMillis(500), p.backoffAfter(1));
        assertEquals(Duration.ofMillis(1000), p.backoffAfter(2));
        assertEquals(Duration.ofMillis(2000), p.backoffAfter(3));
        assertEquals(Duration.ofSeconds(3), p.attemptTimeout());
    }

    @Test
    void backoffIsCappedAtMaximum() {
        RetryPolicy p = RetryPolicy.defaults();
        assertEquals(Duration.ofSeconds(5), p.backoffAfter(10));
    }

    @Test
    void attemptBudgetIsBounded() {
        RetryPolicy p = RetryPolicy.defaults();
        assertTrue(p.hasAttemptAfter(3));
        assertFalse(p.hasAttemptAfter(4));
        assertFalse(RetryPolicy.noRetry(Duration.ofSeconds(1)).hasAttemptAfter(1));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().backoffAfter(0));
    }
}
