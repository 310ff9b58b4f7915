package com.questrail.kitchen.time;

import com.questrail.kitchen.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic clock that a test moves by hand. Paired with
 * {@link DeterministicScheduler} it makes attempt timeouts and retry backoff
 * step through exact deadlines.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong elapsed = new AtomicLong();

    @Override
    public long nowNanos() {
        return elapsed.get();
    }

    public void advance(Duration step) {
        if (step.isNegative()) {
            throw new IllegalArgumentException("Monotonic time only moves forward (step " + step + ")");
        }
        elapsed.addAndGet(step.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
