package com.questrail.kitchen.observability;

import java.time.Instant;
import java.util.Optional;

/**
 * An unexpected failure inside the engine, e.g. a ticket that could not be
 * built or a callback that threw.
 *
 * @param orderId order being handled, or {@code null} if none
 */
public record RoutingErrorEvent(Instant timestamp, String orderId, String message, Throwable cause)
{
    public Optional<String> order() {
        return Optional.ofNullable(orderId);
    }
}
