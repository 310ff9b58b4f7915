package com.questrail.kitchen.internal.time;

import java.time.Instant;

/**
 * Source of timestamps for print jobs, attempts and observability events.
 */
public interface WallClock
{
    Instant now();
}
