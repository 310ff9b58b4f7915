package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.StationId;

import java.time.Instant;
import java.util.Objects;

/**
 * Operational note produced by a cancellation that could not retract a ticket.
 * Never an error: a ticket that already printed cannot be unprinted.
 */
public record CancellationNote(Instant at, String orderId, StationId stationId, PrintJobId jobId, Kind kind, String message)
{
    public enum Kind {
        /** The printer had already acknowledged the ticket. */
        ALREADY_PRINTED,
        /** An attempt was on the wire; the ticket may or may not print. No retry will follow. */
        IN_FLIGHT,
        /** The job had already failed; nothing printed. */
        ALREADY_FAILED,
        /** The ticket also carries items that are not being removed, so it stays. */
        RETAINED
    }

    public CancellationNote {
        Objects.requireNonNull(at, "at");
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
