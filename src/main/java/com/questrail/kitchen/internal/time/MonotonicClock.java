package com.questrail.kitchen.internal.time;

/**
 * Source of elapsed time for retry backoff and attempt timeouts.
 *
 * <p>Values only mean something relative to each other. Use {@link WallClock}
 * for timestamps that end up in reports or logs.</p>
 */
public interface MonotonicClock
{
    long nowNanos();
}
