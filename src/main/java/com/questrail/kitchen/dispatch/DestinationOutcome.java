package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.api.StationKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome for one manifest entry.
 *
 * @param deliveredVia backup station that printed the ticket, for {@link DeliveryStatus#FAILED_OVER}
 * @param subscribers  subscribers reached, for display stations
 */
public record DestinationOutcome(
        StationId stationId,
        String stationName,
        StationKind kind,
        DeliveryStatus status,
        List<DispatchAttempt> attempts,
        PrintJobId jobId,
        StationId deliveredVia,
        int subscribers,
        String detail
) {
    public DestinationOutcome {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(stationName, "stationName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        attempts = List.copyOf(Objects.requireNonNull(attempts, "attempts"));
    }

    public Optional<PrintJobId> job() {
        return Optional.ofNullable(jobId);
    }

    public Optional<StationId> backup() {
        return Optional.ofNullable(deliveredVia);
    }

    public Optional<String> details() {
        return Optional.ofNullable(detail);
    }
}
