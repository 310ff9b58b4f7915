package com.questrail.kitchen.print;

import com.questrail.kitchen.api.StationId;

import java.util.Objects;

/**
 * Why no ticket could be built for a printer station.
 */
public record TicketBuildFailure(StationId stationId, String reason, Throwable cause)
{
    public TicketBuildFailure {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(reason, "reason");
    }
}
