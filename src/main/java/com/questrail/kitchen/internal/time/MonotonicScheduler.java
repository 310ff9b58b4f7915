package com.questrail.kitchen.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Schedules dispatch timing work: retry backoff and per-attempt timeouts.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are monotonic nanoseconds, never wall-clock instants, so a clock
 * adjustment on the POS terminal cannot fire or starve a retry.
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} at or after {@code deadlineNanos}.
     *
     * @param deadlineNanos deadline on the {@link MonotonicClock} time line
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
