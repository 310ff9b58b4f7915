package com.questrail.kitchen.api;

import java.util.Objects;

/**
 * Identifier of a configured station (kitchen display or printer).
 */
public record StationId(String value)
{
    public StationId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Station id must not be blank");
        }
    }

    public static StationId of(String value) {
        return new StationId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
