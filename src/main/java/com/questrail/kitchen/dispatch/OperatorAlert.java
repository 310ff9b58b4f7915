package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.StationId;

import java.time.Instant;
import java.util.Objects;

/**
 * A printer problem a person must act on: a ticket that did not print.
 */
public record OperatorAlert(Instant at, String orderId, StationId stationId, String stationName, String message)
{
    public OperatorAlert {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(stationName, "stationName");
        Objects.requireNonNull(message, "message");
    }
}
