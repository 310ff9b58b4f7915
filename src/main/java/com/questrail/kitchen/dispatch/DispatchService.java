package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.OrderContext;
import com.questrail.kitchen.api.RoutingManifest;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.api.Station;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.api.StationKind;
import com.questrail.kitchen.channel.StationChannelHub;
import com.questrail.kitchen.config.PrinterStationConfig;
import com.questrail.kitchen.internal.time.Cancellable;
import com.questrail.kitchen.internal.time.MonotonicClock;
import com.questrail.kitchen.internal.time.MonotonicScheduler;
import com.questrail.kitchen.internal.time.WallClock;
import com.questrail.kitchen.observability.CancellationNoteEvent;
import com.questrail.kitchen.observability.DispatchCompletedEvent;
import com.questrail.kitchen.observability.NullObservabilitySink;
import com.questrail.kitchen.observability.PrintJobTerminalEvent;
import com.questrail.kitchen.observability.RoutingErrorEvent;
import com.questrail.kitchen.observability.RoutingObservabilitySink;
import com.questrail.kitchen.print.PreparedTicket;
import com.questrail.kitchen.print.TicketBuildException;
import com.questrail.kitchen.print.TicketBuildFailure;
import com.questrail.kitchen.print.TicketBundle;
import com.questrail.kitchen.print.TicketBundleBuilder;
import com.questrail.kitchen.registry.RegistrySnapshot;
import com.questrail.kitchen.transport.PrinterAck;
import com.questrail.kitchen.transport.PrinterTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * DispatchService
 * =============================================================================
 * Fans a resolved manifest out to its destinations.
 *
 * <h2>Destinations</h2>
 * <ul>
 *   <li><b>Display</b>: the entry is published on the station channel.
 *       Fire-and-forget, at most once per connected subscriber.</li>
 *   <li><b>Printer</b>: one {@link PrintJob} per entry. Each attempt waits for
 *       the printer status byte within the attempt timeout. Failed attempts
 *       are retried with the {@link RetryPolicy} backoff. When the budget is
 *       spent the job is FAILED, the operator is alerted, and the ticket is
 *       sent to the station's backup printer if it has one.</li>
 * </ul>
 *
 * <h2>Independence</h2>
 * Every destination runs as its own task with its own timeout and retry
 * budget. A dead printer never delays another destination; the report is
 * produced when the last destination is terminal.
 *
 * <h2>Timing</h2>
 * Timeouts and backoff go through the {@link MonotonicScheduler}; attempt
 * results are handled on the dispatch executor. The service holds no lock
 * while calling the transport.
 */
public final class DispatchService
{
    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final PrinterTransport transport;
    private final StationChannelHub hub;
    private final TicketBundleBuilder tickets;
    private final Function<StationId, PrinterStationConfig> printers;
    private final Supplier<RegistrySnapshot> registry;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final OperatorAlertChannel alerts;
    private final RoutingObservabilitySink sink;

    private final AtomicLong jobSequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    private final Set<Delivery> active = ConcurrentHashMap.newKeySet();
    private final Map<PrintJobId, Delivery> deliveries = new ConcurrentHashMap<>();
    private final Map<String, List<PrintJob>> jobsByOrder;

    private DispatchService(Builder b) {
        this.transport = Objects.requireNonNull(b.transport, "transport");
        this.hub = Objects.requireNonNull(b.hub, "hub");
        this.tickets = Objects.requireNonNull(b.tickets, "tickets");
        this.printers = Objects.requireNonNull(b.printers, "printers");
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.retryPolicy = Objects.requireNonNull(b.retryPolicy, "retryPolicy");
        this.executor = Objects.requireNonNull(b.executor, "executor");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.alerts = Objects.requireNonNull(b.alerts, "alerts");
        this.sink = Objects.requireNonNull(b.sink, "sink");

        int retention = b.retainedOrders;
        if (retention < 1) {
            throw new IllegalArgumentException("retainedOrders must be >= 1");
        }
        this.jobsByOrder = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<PrintJob>> eldest) {
                return size() > retention;
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Dispatches and waits until every destination is terminal.
     *
     * @throws DispatchUnavailableException if nothing can be dispatched, or the wait is interrupted
     */
    public DispatchReport dispatch(RoutingManifest manifest, TicketBundle bundle) {
        CompletableFuture<DispatchReport> report = dispatchAsync(manifest, bundle);
        try {
            return report.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchUnavailableException("Interrupted while waiting for dispatch of order " + manifest.orderId(), e);
        }
        catch (ExecutionException e) {
            throw new DispatchUnavailableException("Dispatch of order " + manifest.orderId() + " failed", e.getCause());
        }
    }

    /**
     * Starts dispatch and returns a future that completes with the report once
     * every destination is terminal.
     *
     * <p>If the executor starts rejecting work part way through, the
     * destinations it did not take are reported as FAILED.</p>
     *
     * @throws DispatchUnavailableException if the service is shut down, the
     *         executor takes no work at all, or every destination is a printer
     *         and the printer transport is down
     */
    public CompletableFuture<DispatchReport> dispatchAsync(RoutingManifest manifest, TicketBundle bundle) {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(bundle, "bundle");
        requireAvailable(manifest);

        List<Delivery> started = new ArrayList<>();
        for (RoutingManifestEntry entry : manifest.entries()) {
            Delivery d = new Delivery(manifest.context(), entry);
            active.add(d);
            d.outcome.whenComplete((o, e) -> active.remove(d));
            started.add(d);
        }

        List<CompletableFuture<DestinationOutcome>> outcomes = new ArrayList<>();
        for (int i = 0; i < started.size(); i++) {
            Delivery d = started.get(i);
            outcomes.add(d.outcome);
            try {
                executor.execute(() -> start(d, bundle));
            }
            catch (RejectedExecutionException e) {
                List<Delivery> unstarted = started.subList(i, started.size());
                for (Delivery u : unstarted) {
                    u.outcome.complete(u.finish(DeliveryStatus.FAILED, null, "Dispatch executor rejected the task"));
                }
                if (i == 0) {
                    throw new DispatchUnavailableException("Dispatch executor is not accepting work", e);
                }
                // earlier destinations are already under way; report the rest as failed
                sink.onError(new RoutingErrorEvent(wallClock.now(), manifest.orderId(),
                        "Dispatch executor rejected " + unstarted.size() + " destination(s)", e));
                for (Delivery u : unstarted.subList(1, unstarted.size())) {
                    outcomes.add(u.outcome);
                }
                break;
            }
        }

        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0]))
                .thenApply(v -> {
                    List<DestinationOutcome> results = new ArrayList<>();
                    for (CompletableFuture<DestinationOutcome> f : outcomes) {
                        results.add(f.join());
                    }
                    DispatchReport report = new DispatchReport(manifest.orderId(), results, manifest.unrouted());
                    sink.onDispatchCompleted(new DispatchCompletedEvent(wallClock.now(), report));
                    return report;
                });
    }

    /**
     * Current state of every destination still being delivered for an order.
     */
    public List<DestinationOutcome> progress(String orderId) {
        List<DestinationOutcome> out = new ArrayList<>();
        for (Delivery d : active) {
            if (d.order.orderId().equals(orderId)) {
                out.add(d.snapshot());
            }
        }
        return out;
    }

    /**
     * Cancels every print job of an order that has not printed yet.
     */
    public CancellationResult cancelOrder(String orderId) {
        Objects.requireNonNull(orderId, "orderId");
        return cancel(orderId, null);
    }

    /**
     * Cancels the print jobs that carry only the given items.
     *
     * <p>A ticket cannot be partially retracted: a job that also carries items
     * not being removed keeps printing and is reported as
     * {@link CancellationNote.Kind#RETAINED}.</p>
     */
    public CancellationResult cancelItems(String orderId, Set<String> itemIds) {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(itemIds, "itemIds");
        return cancel(orderId, Set.copyOf(itemIds));
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops intake and waits up to {@code drainTimeout} for in-flight
     * deliveries. Whatever is still running afterwards is abandoned as FAILED
     * and the operator is alerted.
     *
     * @return {@code true} if every delivery finished in time
     */
    public boolean shutdown(Duration drainTimeout) {
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        closed.set(true);

        List<Delivery> pending = new ArrayList<>(active);
        if (pending.isEmpty()) {
            return true;
        }
        log.info("Draining {} in-flight deliveries (timeout {})", pending.size(), drainTimeout);

        CompletableFuture<?>[] futures = new CompletableFuture<?>[pending.size()];
        for (int i = 0; i < futures.length; i++) {
            futures[i] = pending.get(i).outcome;
        }
        try {
            CompletableFuture.allOf(futures).get(drainTimeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        }
        catch (TimeoutException e) {
            abandon("Shut down before delivery completed");
            return false;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon("Shutdown interrupted before delivery completed");
            return false;
        }
        catch (ExecutionException e) {
            sink.onError(new RoutingErrorEvent(wallClock.now(), null, "Delivery failed during drain", e.getCause()));
            return true;
        }
    }

    // -------------------------------------------------------------------------
    // Delivery
    // -------------------------------------------------------------------------

    private void requireAvailable(RoutingManifest manifest) {
        if (closed.get()) {
            throw new DispatchUnavailableException("Dispatch service is shut down");
        }
        boolean anyDisplay = false;
        boolean anyPrinter = false;
        for (RoutingManifestEntry e : manifest.entries()) {
            anyDisplay |= e.kind() == StationKind.DISPLAY;
            anyPrinter |= e.kind() == StationKind.PRINTER;
        }
        if (anyPrinter && !anyDisplay && !transport.isRunning()) {
            throw new DispatchUnavailableException(
                    "Printer transport is down and order " + manifest.orderId() + " has no display destination");
        }
    }

    private void start(Delivery d, TicketBundle bundle) {
        try {
            if (d.entry.kind() == StationKind.DISPLAY) {
                publish(d);
                return;
            }
            Optional<TicketBuildFailure> failure = bundle.failure(d.entry.stationId());
            if (failure.isPresent()) {
                sink.onError(new RoutingErrorEvent(wallClock.now(), d.order.orderId(),
                        "Ticket build failed for station " + d.entry.stationName() + ": " + failure.get().reason(),
                        failure.get().cause()));
                d.outcome.complete(d.finish(DeliveryStatus.BUILD_FAILED, null, failure.get().reason()));
                return;
            }
            Optional<PreparedTicket> ticket = bundle.ticket(d.entry.stationId());
            if (ticket.isEmpty()) {
                d.outcome.complete(d.finish(DeliveryStatus.BUILD_FAILED, null,
                        "No ticket was built for station " + d.entry.stationId()));
                return;
            }
            attempt(d, newJob(d, d.entry.stationId(), ticket.get()));
        }
        catch (RuntimeException e) {
            sink.onError(new RoutingErrorEvent(wallClock.now(), d.order.orderId(),
                    "Delivery to station " + d.entry.stationName() + " failed unexpectedly", e));
            d.outcome.complete(d.finish(DeliveryStatus.FAILED, null, String.valueOf(e.getMessage())));
        }
    }

    private void publish(Delivery d) {
        int subscribers = hub.publish(d.order, d.entry);
        d.record(new DispatchAttempt(d.entry.stationId(), 1, wallClock.now(), AttemptOutcome.PUBLISHED,
                subscribers + " subscriber(s)"));
        d.subscribers = subscribers;
        d.outcome.complete(d.finish(DeliveryStatus.PUBLISHED, null, null));
    }

    private PrintJob newJob(Delivery d, StationId target, PreparedTicket ticket) {
        PrintJob job = new PrintJob(new PrintJobId("job-" + jobSequence.incrementAndGet()),
                d.order.orderId(), d.entry, target, ticket, wallClock.now());
        d.current = job;
        if (d.primary == null) {
            d.primary = job;
        }
        deliveries.put(job.id(), d);
        d.outcome.whenComplete((o, e) -> deliveries.remove(job.id()));
        synchronized (jobsByOrder) {
            jobsByOrder.computeIfAbsent(job.orderId(), id -> new ArrayList<>()).add(job);
        }
        return job;
    }

    private void attempt(Delivery d, PrintJob job) {
        if (!job.beginAttempt()) {
            finishCancelled(d, job);
            return;
        }
        int attemptNumber = job.attemptCount() + 1;

        CompletableFuture<PrinterAck> ack;
        try {
            ack = transport.send(job.ticket().printer().address(), job.payload());
        }
        catch (RuntimeException e) {
            ack = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<PrinterAck> attempt = ack;
        Cancellable timeout = scheduler.scheduleAfter(retryPolicy.attemptTimeout(), clock,
                () -> attempt.completeExceptionally(new TimeoutException(
                        "No printer status within " + retryPolicy.attemptTimeout().toMillis() + " ms")));

        attempt.whenCompleteAsync((result, error) -> {
            timeout.cancel();
            onAttemptResult(d, job, attemptNumber, result, error);
        }, executor);
    }

    private void onAttemptResult(Delivery d, PrintJob job, int attemptNumber, PrinterAck ack, Throwable error) {
        AttemptOutcome outcome;
        String detail = null;
        if (error == null && ack.ready()) {
            outcome = AttemptOutcome.ACKNOWLEDGED;
        }
        else if (error == null) {
            outcome = AttemptOutcome.PRINTER_NOT_READY;
            detail = ack.toString();
        }
        else {
            Throwable cause = unwrap(error);
            outcome = cause instanceof TimeoutException ? AttemptOutcome.TIMED_OUT : AttemptOutcome.TRANSPORT_ERROR;
            detail = cause.getMessage();
        }

        DispatchAttempt record = new DispatchAttempt(job.target(), attemptNumber, wallClock.now(), outcome, detail);
        if (d.outcome.isDone() || !job.recordAttempt(record)) {
            // delivery was abandoned or settled while this attempt was on the wire
            log.debug("{}: attempt {} ended {} after delivery was settled; ignored", job, attemptNumber, outcome);
            return;
        }
        d.record(record);

        if (outcome == AttemptOutcome.ACKNOWLEDGED) {
            terminal(job);
            boolean backup = !job.target().equals(d.entry.stationId());
            d.outcome.complete(d.finish(backup ? DeliveryStatus.FAILED_OVER : DeliveryStatus.DELIVERED,
                    backup ? job.target() : null, null));
            return;
        }
        if (job.settleCancelled()) {
            finishCancelled(d, job);
            return;
        }
        if (retryPolicy.hasAttemptAfter(attemptNumber)) {
            Duration backoff = retryPolicy.backoffAfter(attemptNumber);
            log.debug("{}: attempt {} {} ({}), retry in {} ms",
                    job, attemptNumber, outcome, detail, backoff.toMillis());
            d.pendingRetry = scheduler.scheduleAfter(backoff, clock, () -> retry(d, job));
            return;
        }

        job.fail();
        terminal(job);
        exhausted(d, job);
    }

    private void retry(Delivery d, PrintJob job) {
        try {
            executor.execute(() -> attempt(d, job));
        }
        catch (RejectedExecutionException e) {
            job.fail();
            terminal(job);
            d.outcome.complete(d.finish(DeliveryStatus.FAILED, null, "Dispatch executor stopped before retry"));
        }
    }

    private void exhausted(Delivery d, PrintJob job) {
        String lastFailure = job.attempts().isEmpty() ? "" :
                " (last: " + job.attempts().get(job.attempts().size() - 1).outcome() + ")";

        Optional<StationId> backupId = d.failedOver ? Optional.empty() : backupFor(d.entry.stationId());
        PrinterStationConfig backupConfig = backupId.map(printers).orElse(null);

        if (backupConfig != null) {
            alert(d, "Printer " + d.entry.stationName() + " did not print after " + job.attemptCount()
                    + " attempt(s)" + lastFailure + "; ticket sent to backup printer " + backupId.get());
            PreparedTicket ticket;
            try {
                ticket = tickets.prepare(d.entry, d.order, backupConfig);
            }
            catch (RuntimeException e) {
                String reason = e instanceof TicketBuildException ? e.getMessage() : e.toString();
                alert(d, "Backup ticket for " + d.entry.stationName() + " could not be built: " + reason);
                d.outcome.complete(d.finish(DeliveryStatus.FAILED, null, "Backup ticket build failed: " + reason));
                return;
            }
            d.failedOver = true;
            attempt(d, newJob(d, backupId.get(), ticket));
            return;
        }

        alert(d, "Ticket for " + d.entry.stationName() + " did not print after " + job.attemptCount()
                + " attempt(s)" + lastFailure + (d.failedOver ? " on backup printer " + job.target() : ""));
        d.outcome.complete(d.finish(DeliveryStatus.FAILED, null,
                "Retries exhausted" + (d.failedOver ? " on primary and backup printer" : "")));
    }

    private Optional<StationId> backupFor(StationId stationId) {
        RegistrySnapshot snapshot = registry.get();
        return snapshot.station(stationId)
                .flatMap(Station::backupStationId)
                .flatMap(snapshot::station)
                .filter(s -> s.active() && s.kind() == StationKind.PRINTER)
                .map(Station::id);
    }

    private void finishCancelled(Delivery d, PrintJob job) {
        if (d.outcome.complete(d.finish(DeliveryStatus.CANCELLED, null, "Cancelled before printing"))) {
            terminal(job);
        }
    }

    private void terminal(PrintJob job) {
        sink.onPrintJobTerminal(PrintJobTerminalEvent.of(wallClock.now(), job));
    }

    private void alert(Delivery d, String message) {
        try {
            alerts.alert(new OperatorAlert(wallClock.now(), d.order.orderId(), d.entry.stationId(),
                    d.entry.stationName(), message));
        }
        catch (RuntimeException e) {
            sink.onError(new RoutingErrorEvent(wallClock.now(), d.order.orderId(), "Operator alert channel failed", e));
        }
    }

    private void abandon(String reason) {
        for (Delivery d : new ArrayList<>(active)) {
            Cancellable retry = d.pendingRetry;
            if (retry != null) {
                retry.cancel();
            }
            PrintJob job = d.current;
            if (job != null) {
                job.fail();
            }
            if (d.outcome.complete(d.finish(DeliveryStatus.FAILED, null, reason))) {
                if (job != null) {
                    terminal(job);
                    alert(d, reason);
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Cancellation
    // -------------------------------------------------------------------------

    private CancellationResult cancel(String orderId, Set<String> itemIds) {
        List<PrintJob> jobs;
        synchronized (jobsByOrder) {
            jobs = new ArrayList<>(jobsByOrder.getOrDefault(orderId, List.of()));
        }

        List<PrintJobId> cancelled = new ArrayList<>();
        List<CancellationNote> notes = new ArrayList<>();

        for (PrintJob job : jobs) {
            Delivery d = deliveries.get(job.id());
            if (d != null && d.current != job) {
                // superseded by a failover job
                continue;
            }
            if (itemIds != null) {
                if (Collections.disjoint(job.itemIds(), itemIds)) {
                    continue;
                }
                if (!itemIds.containsAll(job.itemIds())) {
                    notes.add(note(job, CancellationNote.Kind.RETAINED,
                            "Ticket also carries items that are not being removed"));
                    continue;
                }
            }

            PrintJob.CancelView view = job.requestCancel();
            switch (view.state()) {
                case ACKNOWLEDGED -> notes.add(note(job, CancellationNote.Kind.ALREADY_PRINTED,
                        "Ticket already printed at " + job.target() + "; tell the station"));
                case FAILED -> notes.add(note(job, CancellationNote.Kind.ALREADY_FAILED,
                        "Ticket never printed"));
                case CANCELLED -> {
                    // cancelled earlier
                }
                default -> {
                    if (view.inFlight()) {
                        notes.add(note(job, CancellationNote.Kind.IN_FLIGHT,
                                "Ticket was being transmitted; it may still print. No retry will follow"));
                    }
                    else {
                        cancelled.add(job.id());
                        if (d != null) {
                            Cancellable retry = d.pendingRetry;
                            if (retry != null) {
                                retry.cancel();
                            }
                            finishCancelled(d, job);
                        }
                    }
                }
            }
        }

        for (CancellationNote n : notes) {
            sink.onCancellationNote(new CancellationNoteEvent(n.at(), n));
        }
        return new CancellationResult(orderId, cancelled, notes);
    }

    private CancellationNote note(PrintJob job, CancellationNote.Kind kind, String message) {
        return new CancellationNote(wallClock.now(), job.orderId(), job.stationId(), job.id(), kind, message);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }

    /**
     * Delivery
     * -------------------------------------------------------------------------
     * Per-destination bookkeeping. Attempts from the primary and the backup
     * printer are kept in one history.
     */
    private static final class Delivery
    {
        final OrderContext order;
        final RoutingManifestEntry entry;
        final CompletableFuture<DestinationOutcome> outcome = new CompletableFuture<>();
        private final List<DispatchAttempt> history = new ArrayList<>();

        volatile PrintJob primary;
        volatile PrintJob current;
        volatile Cancellable pendingRetry;
        volatile boolean failedOver;
        volatile int subscribers;

        Delivery(OrderContext order, RoutingManifestEntry entry) {
            this.order = order;
            this.entry = entry;
        }

        synchronized void record(DispatchAttempt attempt) {
            history.add(attempt);
        }

        synchronized DestinationOutcome finish(DeliveryStatus status, StationId deliveredVia, String detail) {
            PrintJob p = primary;
            return new DestinationOutcome(entry.stationId(), entry.stationName(), entry.kind(), status,
                    history, p == null ? null : p.id(), deliveredVia, subscribers, detail);
        }

        DestinationOutcome snapshot() {
            PrintJob job = current;
            DeliveryStatus status = job != null && !job.inFlight() && job.attemptCount() > 0
                    ? DeliveryStatus.PENDING_RETRY
                    : DeliveryStatus.IN_PROGRESS;
            return finish(status, null, null);
        }
    }

    public static final class Builder {
        private PrinterTransport transport;
        private StationChannelHub hub;
        private TicketBundleBuilder tickets;
        private Function<StationId, PrinterStationConfig> printers;
        private Supplier<RegistrySnapshot> registry;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Executor executor;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock;
        private WallClock wallClock;
        private OperatorAlertChannel alerts = new Slf4jOperatorAlertChannel();
        private RoutingObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private int retainedOrders = 500;

        public Builder withTransport(PrinterTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withChannelHub(StationChannelHub hub) {
            this.hub = hub;
            return this;
        }

        public Builder withTicketBuilder(TicketBundleBuilder tickets) {
            this.tickets = tickets;
            return this;
        }

        public Builder withPrinters(Function<StationId, PrinterStationConfig> printers) {
            this.printers = printers;
            return this;
        }

        public Builder withRegistry(Supplier<RegistrySnapshot> registry) {
            this.registry = registry;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withExecutor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withAlerts(OperatorAlertChannel alerts) {
            this.alerts = alerts;
            return this;
        }

        public Builder withObservabilitySink(RoutingObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * Number of most recent orders whose jobs are kept for cancellation lookups.
         */
        public Builder withRetainedOrders(int retainedOrders) {
            this.retainedOrders = retainedOrders;
            return this;
        }

        public DispatchService build() {
            return new DispatchService(this);
        }
    }
}
