package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.OrderItem;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.print.PreparedTicket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * PrintJob
 * =============================================================================
 * One ticket on its way to one printer, owned by the dispatch service for the
 * duration of its delivery.
 *
 * <p>The job records every attempt and tracks whether an attempt is currently
 * on the wire. All state changes are synchronized on the job; the dispatch
 * service never holds a job lock while calling the transport.</p>
 *
 * <p>{@code target} is the printer the job is sent to. For a failover job it
 * is the backup printer while {@code stationId} stays the routed station.</p>
 */
public final class PrintJob
{
    private final PrintJobId id;
    private final String orderId;
    private final StationId stationId;
    private final StationId target;
    private final RoutingManifestEntry entry;
    private final PreparedTicket ticket;
    private final Instant createdAt;
    private final Set<String> itemIds;

    private PrintJobState state = PrintJobState.PENDING;
    private boolean inFlight;
    private boolean cancelRequested;
    private final List<DispatchAttempt> attempts = new ArrayList<>();

    PrintJob(PrintJobId id, String orderId, RoutingManifestEntry entry, StationId target,
             PreparedTicket ticket, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.orderId = Objects.requireNonNull(orderId, "orderId");
        this.entry = Objects.requireNonNull(entry, "entry");
        this.stationId = entry.stationId();
        this.target = Objects.requireNonNull(target, "target");
        this.ticket = Objects.requireNonNull(ticket, "ticket");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");

        Set<String> ids = new LinkedHashSet<>();
        for (OrderItem item : entry.items()) {
            ids.add(item.id());
        }
        this.itemIds = Set.copyOf(ids);
    }

    public PrintJobId id() {
        return id;
    }

    public String orderId() {
        return orderId;
    }

    public StationId stationId() {
        return stationId;
    }

    public StationId target() {
        return target;
    }

    public RoutingManifestEntry entry() {
        return entry;
    }

    public PreparedTicket ticket() {
        return ticket;
    }

    public byte[] payload() {
        return ticket.payloadCopy();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Set<String> itemIds() {
        return itemIds;
    }

    public synchronized PrintJobState state() {
        return state;
    }

    public synchronized boolean inFlight() {
        return inFlight;
    }

    public synchronized boolean cancelRequested() {
        return cancelRequested;
    }

    public synchronized List<DispatchAttempt> attempts() {
        return List.copyOf(attempts);
    }

    public synchronized int attemptCount() {
        return attempts.size();
    }

    /**
     * Marks the start of an attempt.
     *
     * @return {@code false} if the job was cancelled or is already terminal
     */
    synchronized boolean beginAttempt() {
        if (state.terminal() || cancelRequested) {
            return false;
        }
        state = PrintJobState.SENT;
        inFlight = true;
        return true;
    }

    /**
     * Records the result of the attempt that was on the wire. A terminal job
     * keeps its state and history.
     *
     * @return {@code false} if the job was already terminal and the result was dropped
     */
    synchronized boolean recordAttempt(DispatchAttempt attempt) {
        inFlight = false;
        if (state.terminal()) {
            return false;
        }
        attempts.add(attempt);
        state = attempt.outcome() == AttemptOutcome.ACKNOWLEDGED
                ? PrintJobState.ACKNOWLEDGED
                : PrintJobState.PENDING;
        return true;
    }

    synchronized void fail() {
        if (!state.terminal()) {
            state = PrintJobState.FAILED;
        }
        inFlight = false;
    }

    /**
     * Requests cancellation.
     *
     * @return the state and flight status seen at the moment of the request
     */
    synchronized CancelView requestCancel() {
        CancelView view = new CancelView(state, inFlight);
        if (!state.terminal()) {
            cancelRequested = true;
            if (!inFlight) {
                state = PrintJobState.CANCELLED;
            }
        }
        return view;
    }

    /**
     * Settles a job whose cancellation arrived while an attempt was on the wire.
     *
     * @return true if the job ended CANCELLED
     */
    synchronized boolean settleCancelled() {
        if (cancelRequested && !state.terminal()) {
            state = PrintJobState.CANCELLED;
            return true;
        }
        return state == PrintJobState.CANCELLED;
    }

    record CancelView(PrintJobState state, boolean inFlight) {
    }

    @Override
    public String toString() {
        return "PrintJob[" + id + " order=" + orderId + " station=" + stationId
                + (target.equals(stationId) ? "" : " via " + target) + " " + state() + "]";
    }
}
