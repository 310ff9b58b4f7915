package com.questrail.kitchen.internal.time;

import java.time.Instant;

/**
 * {@link WallClock} backed by the system clock in UTC.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
