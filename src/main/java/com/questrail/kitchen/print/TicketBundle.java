package com.questrail.kitchen.print;

import com.questrail.kitchen.api.StationId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The tickets of one manifest: a prepared ticket or a build failure for every
 * printer entry.
 */
public final class TicketBundle
{
    private static final TicketBundle EMPTY = new TicketBundle(Map.of(), Map.of());

    private final Map<StationId, PreparedTicket> tickets;
    private final Map<StationId, TicketBuildFailure> failures;

    public TicketBundle(Map<StationId, PreparedTicket> tickets, Map<StationId, TicketBuildFailure> failures) {
        this.tickets = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(tickets, "tickets")));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(failures, "failures")));
    }

    public static TicketBundle empty() {
        return EMPTY;
    }

    public Optional<PreparedTicket> ticket(StationId stationId) {
        return Optional.ofNullable(tickets.get(stationId));
    }

    public Optional<TicketBuildFailure> failure(StationId stationId) {
        return Optional.ofNullable(failures.get(stationId));
    }

    public Map<StationId, PreparedTicket> tickets() {
        return tickets;
    }

    public Map<StationId, TicketBuildFailure> failures() {
        return failures;
    }

    @Override
    public String toString() {
        return "TicketBundle[tickets=" + tickets.keySet() + " failures=" + failures.keySet() + "]";
    }
}
