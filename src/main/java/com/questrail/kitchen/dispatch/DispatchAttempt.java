package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.StationId;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One delivery attempt, kept for observability.
 *
 * @param target        station the attempt went to (a backup printer during failover)
 * @param attemptNumber 1-based, per target
 * @param detail        failure description, or the subscriber count of a publication
 */
public record DispatchAttempt(StationId target, int attemptNumber, Instant at, AttemptOutcome outcome, String detail)
{
    public DispatchAttempt {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(outcome, "outcome");
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
    }

    public Optional<String> details() {
        return Optional.ofNullable(detail);
    }
}
