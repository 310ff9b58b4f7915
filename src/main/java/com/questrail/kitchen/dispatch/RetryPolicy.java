package com.questrail.kitchen.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * RetryPolicy
 * -----------------------------------------------------------------------------
 * Bounded exponential backoff for printer delivery.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxAttempts</b>: attempts per printer, the first one included.</li>
 *   <li><b>initialBackoff</b>: wait after the first failed attempt.</li>
 *   <li><b>multiplier</b>: growth of the wait after each further failure.</li>
 *   <li><b>maxBackoff</b>: ceiling on any single wait.</li>
 *   <li><b>attemptTimeout</b>: how long one attempt may wait for the printer's
 *       status byte before it counts as failed.</li>
 * </ul>
 *
 * <p>With the defaults a dead printer is given up on after four attempts and
 * roughly 3.5 s of backoff, plus up to 3 s per attempt.</p>
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff,
        Duration attemptTimeout
) {
    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout");

        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1.0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
    }

    /**
     * Default values: 4 attempts, 500 ms initial backoff, multiplier 2.0,
     * 5 s backoff ceiling, 3 s attempt timeout.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(4, Duration.ofMillis(500), 2.0, Duration.ofSeconds(5), Duration.ofSeconds(3));
    }

    /**
     * A single attempt, no retries.
     */
    public static RetryPolicy noRetry(Duration attemptTimeout) {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, attemptTimeout);
    }

    /**
     * Wait before the attempt that follows failed attempt {@code failedAttempt} (1-based).
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        double nanos = initialBackoff.toNanos() * Math.pow(multiplier, failedAttempt - 1);
        if (nanos >= maxBackoff.toNanos()) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }

    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts;
    }
}
