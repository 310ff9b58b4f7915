package com.questrail.kitchen.print;

import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.config.PrinterStationConfig;
import com.questrail.kitchen.print.model.PrintTicket;

import java.util.Objects;

/**
 * A ticket built and encoded for one printer, ready for the transport.
 */
public record PreparedTicket(StationId stationId, PrinterStationConfig printer, PrintTicket ticket, byte[] payload)
{
    public PreparedTicket {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(printer, "printer");
        Objects.requireNonNull(ticket, "ticket");
        Objects.requireNonNull(payload, "payload");
    }

    /**
     * Returns a copy of the payload. The transport writes the bytes once and never mutates them.
     */
    public byte[] payloadCopy() {
        return payload.clone();
    }
}
