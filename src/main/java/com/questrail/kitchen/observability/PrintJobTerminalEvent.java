package com.questrail.kitchen.observability;

import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.dispatch.DispatchAttempt;
import com.questrail.kitchen.dispatch.PrintJob;
import com.questrail.kitchen.dispatch.PrintJobId;
import com.questrail.kitchen.dispatch.PrintJobState;

import java.time.Instant;
import java.util.List;

/**
 * A print job reached ACKNOWLEDGED, FAILED or CANCELLED. This is the audit
 * record for "the ticket never printed" investigations.
 */
public record PrintJobTerminalEvent(
        Instant timestamp,
        PrintJobId jobId,
        String orderId,
        StationId stationId,
        StationId target,
        PrintJobState state,
        List<DispatchAttempt> attempts
) {
    public PrintJobTerminalEvent {
        attempts = List.copyOf(attempts);
    }

    public static PrintJobTerminalEvent of(Instant timestamp, PrintJob job) {
        return new PrintJobTerminalEvent(timestamp, job.id(), job.orderId(), job.stationId(), job.target(),
                job.state(), job.attempts());
    }
}
