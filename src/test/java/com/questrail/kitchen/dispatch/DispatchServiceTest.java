package com.questrail.kitchen.dispatch;

import com.questrail.kitchen.api.OrderContext;
import com.questrail.kitchen.api.OrderItem;
import com.questrail.kitchen.api.OrderSnapshot;
import com.questrail.kitchen.api.RoutingManifest;
import com.questrail.kitchen.api.Station;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.channel.StationChannelHub;
import com.questrail.kitchen.channel.StationSubscription;
import com.questrail.kitchen.config.PrinterStationConfig;
import com.questrail.kitchen.observability.CancellationNoteEvent;
import com.questrail.kitchen.observability.DispatchCompletedEvent;
import com.questrail.kitchen.observability.PrintJobTerminalEvent;
import com.questrail.kitchen.observability.RecordingObservabilitySink;
import com.questrail.kitchen.observability.RoutingErrorEvent;
import com.questrail.kitchen.print.PrintTemplateFactory;
import com.questrail.kitchen.print.TicketBundleBuilder;
import com.questrail.kitchen.print.TicketLayout;
import com.questrail.kitchen.registry.StationRegistry;
import com.questrail.kitchen.registry.TagRegistry;
import com.questrail.kitchen.routing.RoutingResolver;
import com.questrail.kitchen.time.DeterministicScheduler;
import com.questrail.kitchen.time.FixedWallClock;
import com.questrail.kitchen.time.ManualMonotonicClock;
import com.questrail.kitchen.transport.FakePrinterTransport;
import com.questrail.kitchen.transport.PrinterAck;
import com.questrail.kitchen.transport.PrinterTransportException;
import com.questrail.kitchen.transport.FakePrinterTransport.Reply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DispatchServiceTest
 * -----------------------------------------------------------------------------
 * Drives the dispatch service with a direct executor, a manual clock and a
 * scripted printer transport. Time only moves when a test advances it, so
 * attempt timeouts and backoff are observable step by step.
 */
class DispatchServiceTest {

    private static final String GRILL_HOST = "10.0.0.20";
    private static final String EXPO_HOST = "10.0.0.30";
    private static final String BAR_HOST = "10.0.0.40";

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FixedWallClock wallClock = new FixedWallClock();
    private final FakePrinterTransport transport = new FakePrinterTransport();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RecordingAlertChannel alerts = new RecordingAlertChannel();
    private final StationChannelHub hub = new StationChannelHub(wallClock, 16);
    private final Map<StationId, PrinterStationConfig> printers = new HashMap<>();

    private StationRegistry stations;
    private TicketBundleBuilder tickets;

    @BeforeEach
    void setUp() {
        stations = new StationRegistry(List.of(
                Station.display("grill-kds", "Grill KDS").tags("grill").build(),
                Station.printer("grill-printer", "Grill Printer").tags("grill").backup("expo-printer").build(),
                Station.printer("bar-printer", "Bar Printer").tags("bar").build(),
                Station.printer("expo-printer", "Expo Printer").tags("expo").build()));

        printers.put(StationId.of("grill-printer"), PrinterStationConfig.builder("grill-printer").withHost(GRILL_HOST).build());
        printers.put(StationId.of("expo-printer"), PrinterStationConfig.builder("expo-printer").withHost(EXPO_HOST).build());
        printers.put(StationId.of("bar-printer"), PrinterStationConfig.builder("bar-printer").withHost(BAR_HOST).build());

        tickets = new TicketBundleBuilder(new PrintTemplateFactory(), printers::get);
        transport.start();
    }

    private DispatchService service(RetryPolicy policy) {
        return service(policy, Runnable::run);
    }

    private DispatchService service(RetryPolicy policy, Executor executor) {
        return DispatchService.builder()
                .withTransport(transport)
                .withChannelHub(hub)
                .withTicketBuilder(tickets)
                .withPrinters(printers::get)
                .withRegistry(stations::snapshot)
                .withRetryPolicy(policy)
                .withExecutor(executor)
                .withScheduler(scheduler)
                .withClock(clock)
                .withWallClock(wallClock)
                .withAlerts(alerts)
                .withObservabilitySink(sink)
                .build();
    }

    private DispatchService service() {
        return service(RetryPolicy.defaults());
    }

    private static OrderItem burger() {
        return OrderItem.builder("i-burger", "Burger").tags("grill").build();
    }

    private static OrderItem fries() {
        return OrderItem.builder("i-fries", "Fries").tags("grill").build();
    }

    private static OrderItem beer() {
        return OrderItem.builder("i-beer", "Beer").tags("bar").build();
    }

    private RoutingManifest resolve(OrderItem... items) {
        OrderSnapshot order = OrderSnapshot.of(OrderContext.of("order-1", Instant.parse("2024-05-17T18:30:00Z")), items);
        return new RoutingResolver().resolve(order, TagRegistry.defaults(), stations.snapshot());
    }

    private CompletableFuture<DispatchReport> dispatch(DispatchService service, RoutingManifest manifest) {
        return service.dispatchAsync(manifest, tickets.build(manifest));
    }

    private void advance(long millis) {
        clock.advanceMillis(millis);
        scheduler.runDueTasks();
    }

    @Test
    void everyDestinationDeliveredGivesSent() {
        StationSubscription kds = hub.subscribe(StationId.of("grill-kds"));
        DispatchService service = service();

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger(), beer()));

        assertTrue(future.isDone());
        DispatchReport report = future.join();
        assertEquals(DispatchReport.Status.SENT, report.status());

        DestinationOutcome display = report.outcome(StationId.of("grill-kds")).orElseThrow();
        assertEquals(DeliveryStatus.PUBLISHED, display.status());
        assertEquals(1, display.subscribers());
        assertEquals("1 subscriber(s)", display.attempts().get(0).detail());
        assertEquals(1, kds.pending());

        DestinationOutcome grill = report.outcome(StationId.of("grill-printer")).orElseThrow();
        assertEquals(DeliveryStatus.DELIVERED, grill.status());
        assertEquals(1, grill.attempts().size());
        assertEquals(AttemptOutcome.ACKNOWLEDGED, grill.attempts().get(0).outcome());
        assertTrue(grill.job().isPresent());

        assertEquals(1, transport.sentTo(GRILL_HOST));
        assertEquals(1, transport.sentTo(BAR_HOST));
        assertEquals(1, sink.eventsOfType(DispatchCompletedEvent.class).size());
        assertEquals(2, sink.eventsOfType(PrintJobTerminalEvent.class).size());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void deadPrinterDoesNotHoldBackOtherDestinations() {
        transport.always(BAR_HOST, Reply.REFUSE);
        DispatchService service = service();

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger(), beer()));

        // The grill destinations are done; only the bar printer is still open.
        assertFalse(future.isDone());
        List<DestinationOutcome> progress = service.progress("order-1");
        assertEquals(1, progress.size());
        assertEquals(StationId.of("bar-printer"), progress.get(0).stationId());
        assertEquals(DeliveryStatus.PENDING_RETRY, progress.get(0).status());

        advance(500);
        advance(1000);
        advance(2000);

        assertTrue(future.isDone());
        DispatchReport report = future.join();
        assertEquals(DispatchReport.Status.PARTIALLY_SENT, report.status());

        DestinationOutcome bar = report.outcome(StationId.of("bar-printer")).orElseThrow();
        assertEquals(DeliveryStatus.FAILED, bar.status());
        assertEquals(4, bar.attempts().size());
        for (int i = 0; i < 4; i++) {
            assertEquals(i + 1, bar.attempts().get(i).attemptNumber());
            assertEquals(AttemptOutcome.TRANSPORT_ERROR, bar.attempts().get(i).outcome());
        }
        assertEquals(List.of(bar), report.failed());
        assertEquals(2, report.withStatus(DeliveryStatus.DELIVERED).size());

        assertEquals(1, alerts.alerts().size());
        assertEquals(StationId.of("bar-printer"), alerts.alerts().get(0).stationId());

        PrintJobTerminalEvent barEvent = sink.eventsOfType(PrintJobTerminalEvent.class).stream()
                .filter(e -> e.stationId().equals(StationId.of("bar-printer")))
                .findFirst()
                .orElseThrow();
        assertEquals(PrintJobState.FAILED, barEvent.state());
        assertEquals(4, barEvent.attempts().size());
    }

    @Test
    void retriesFollowTheBackoffSchedule() {
        transport.script(BAR_HOST, Reply.REFUSE, Reply.REFUSE);
        DispatchService service = service();

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(beer()));
        assertEquals(1, transport.sentTo(BAR_HOST));

        advance(499);
        assertEquals(1, transport.sentTo(BAR_HOST));
        advance(1);
        assertEquals(2, transport.sentTo(BAR_HOST));

        advance(999);
        assertEquals(2, transport.sentTo(BAR_HOST));
        advance(1);
        assertEquals(3, transport.sentTo(BAR_HOST));

        DispatchReport report = future.join();
        assertEquals(DispatchReport.Status.SENT, report.status());
        assertEquals(3, report.outcomes().get(0).attempts().size());
        assertTrue(alerts.alerts().isEmpty());
    }

    @Test
    void printerThatIsNotReadyIsRetried() {
        transport.script(BAR_HOST, Reply.OFFLINE);
        DispatchService service = service();

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(beer()));
        advance(500);

        DestinationOutcome bar = future.join().outcomes().get(0);
        assertEquals(DeliveryStatus.DELIVERED, bar.status());
        assertEquals(AttemptOutcome.PRINTER_NOT_READY, bar.attempts().get(0).outcome());
        assertEquals(AttemptOutcome.ACKNOWLEDGED, bar.attempts().get(1).outcome());
    }

    @Test
    void silentPrinterTimesOut() {
        transport.always(BAR_HOST, Reply.HANG);
        DispatchService service = service(RetryPolicy.noRetry(Duration.ofSeconds(1)));

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(beer()));
        assertEquals(DeliveryStatus.IN_PROGRESS, service.progress("order-1").get(0).status());

        advance(999);
        assertFalse(future.isDone());
        advance(1);

        DestinationOutcome bar = future.join().outcomes().get(0);
        assertEquals(DeliveryStatus.FAILED, bar.status());
        assertEquals(AttemptOutcome.TIMED_OUT, bar.attempts().get(0).outcome());
        assertEquals(DispatchReport.Status.NOT_SENT, future.join().status());
    }

    @Test
    void exhaustedPrinterFailsOverToItsBackup() {
        transport.always(GRILL_HOST, Reply.REFUSE);
        DispatchService service = service(new RetryPolicy(2, Duration.ofMillis(100), 1.0, Duration.ofMillis(100),
                Duration.ofSeconds(1)));

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger()));
        advance(100);

        DispatchReport report = future.join();
        DestinationOutcome grill = report.outcome(StationId.of("grill-printer")).orElseThrow();
        assertEquals(DeliveryStatus.FAILED_OVER, grill.status());
        assertEquals(StationId.of("expo-printer"), grill.backup().orElseThrow());
        assertEquals(3, grill.attempts().size());
        assertEquals(StationId.of("expo-printer"), grill.attempts().get(2).target());
        assertEquals(1, grill.attempts().get(2).attemptNumber());
        assertEquals(DispatchReport.Status.SENT, report.status());

        assertEquals(1, transport.sentTo(EXPO_HOST));
        assertEquals(1, alerts.alerts().size());
        assertTrue(alerts.alerts().get(0).message().contains("backup printer"));
    }

    @Test
    void backupFailureEndsFailed() {
        transport.always(GRILL_HOST, Reply.REFUSE).always(EXPO_HOST, Reply.REFUSE);
        DispatchService service = service(new RetryPolicy(2, Duration.ofMillis(100), 1.0, Duration.ofMillis(100),
                Duration.ofSeconds(1)));

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger()));
        advance(100);
        advance(100);

        DestinationOutcome grill = future.join().outcome(StationId.of("grill-printer")).orElseThrow();
        assertEquals(DeliveryStatus.FAILED, grill.status());
        assertEquals(4, grill.attempts().size());
        assertEquals(2, alerts.alerts().size());
        // The display station still got the burger.
        assertEquals(DispatchReport.Status.PARTIALLY_SENT, future.join().status());
    }

    @Test
    void inactiveBackupIsNotUsed() {
        stations.setActive(StationId.of("expo-printer"), false);
        transport.always(GRILL_HOST, Reply.REFUSE);
        DispatchService service = service(RetryPolicy.noRetry(Duration.ofSeconds(1)));

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger()));

        DestinationOutcome grill = future.join().outcome(StationId.of("grill-printer")).orElseThrow();
        assertEquals(DeliveryStatus.FAILED, grill.status());
        assertEquals(0, transport.sentTo(EXPO_HOST));
    }

    @Test
    void ticketBuildFailureOnlyAffectsItsPrinter() {
        printers.put(StationId.of("bar-printer"), PrinterStationConfig.builder("bar-printer")
                .withHost(BAR_HOST)
                .withLayout(TicketLayout.kitchen().toBuilder().buzzerTimes(0).build())
                .build());
        DispatchService service = service();

        DispatchReport report = dispatch(service, resolve(burger(), beer())).join();

        assertEquals(DeliveryStatus.BUILD_FAILED, report.outcome(StationId.of("bar-printer")).orElseThrow().status());
        assertEquals(DeliveryStatus.DELIVERED, report.outcome(StationId.of("grill-printer")).orElseThrow().status());
        assertEquals(DispatchReport.Status.PARTIALLY_SENT, report.status());
        assertEquals(0, transport.sentTo(BAR_HOST));
        assertTrue(sink.hasEventOfType(RoutingErrorEvent.class));
    }

    @Test
    void cancellingBeforeThePrintStopsRetries() {
        transport.always(BAR_HOST, Reply.REFUSE);
        DispatchService service = service();
        CompletableFuture<DispatchReport> future = dispatch(service, resolve(beer()));

        CancellationResult result = service.cancelOrder("order-1");

        assertEquals(1, result.cancelled().size());
        assertTrue(result.notes().isEmpty());
        assertTrue(future.isDone());
        assertEquals(DeliveryStatus.CANCELLED, future.join().outcomes().get(0).status());

        advance(10_000);
        assertEquals(1, transport.sentTo(BAR_HOST));
        assertTrue(alerts.alerts().isEmpty());
        assertEquals(PrintJobState.CANCELLED,
                sink.eventsOfType(PrintJobTerminalEvent.class).get(0).state());

        // A second cancel finds nothing left to do.
        assertTrue(service.cancelOrder("order-1").nothingToCancel());
    }

    @Test
    void cancellingAPrintedTicketLeavesANote() {
        DispatchService service = service();
        dispatch(service, resolve(beer())).join();

        CancellationResult result = service.cancelOrder("order-1");

        assertTrue(result.cancelled().isEmpty());
        assertEquals(1, result.notes().size());
        assertEquals(CancellationNote.Kind.ALREADY_PRINTED, result.notes().get(0).kind());
        assertEquals(1, sink.eventsOfType(CancellationNoteEvent.class).size());
    }

    @Test
    void cancellingDuringAnAttemptStopsFurtherRetries() {
        transport.always(BAR_HOST, Reply.HANG);
        DispatchService service = service();
        CompletableFuture<DispatchReport> future = dispatch(service, resolve(beer()));

        CancellationResult result = service.cancelOrder("order-1");
        assertEquals(CancellationNote.Kind.IN_FLIGHT, result.notes().get(0).kind());
        assertFalse(future.isDone());

        advance(3000);

        assertEquals(DeliveryStatus.CANCELLED, future.join().outcomes().get(0).status());
        assertEquals(1, transport.sentTo(BAR_HOST));
    }

    @Test
    void cancellingAFailedTicketLeavesANote() {
        transport.always(BAR_HOST, Reply.REFUSE);
        DispatchService service = service(RetryPolicy.noRetry(Duration.ofSeconds(1)));
        dispatch(service, resolve(beer())).join();

        CancellationResult result = service.cancelOrder("order-1");

        assertEquals(CancellationNote.Kind.ALREADY_FAILED, result.notes().get(0).kind());
    }

    @Test
    void cancellingSomeItemsKeepsTicketsThatCarryOthers() {
        transport.always(GRILL_HOST, Reply.REFUSE);
        DispatchService service = service();
        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger(), fries()));

        CancellationResult partial = service.cancelItems("order-1", Set.of("i-burger"));
        assertTrue(partial.cancelled().isEmpty());
        assertEquals(CancellationNote.Kind.RETAINED, partial.notes().get(0).kind());
        assertFalse(future.isDone());

        CancellationResult unrelated = service.cancelItems("order-1", Set.of("i-beer"));
        assertTrue(unrelated.nothingToCancel());

        CancellationResult all = service.cancelItems("order-1", Set.of("i-burger", "i-fries"));
        assertEquals(1, all.cancelled().size());
        assertEquals(DeliveryStatus.CANCELLED,
                future.join().outcome(StationId.of("grill-printer")).orElseThrow().status());
    }

    @Test
    void printerOnlyOrderIsRefusedWhileTransportIsDown() {
        transport.stop();
        DispatchService service = service();

        assertThrows(DispatchUnavailableException.class, () -> dispatch(service, resolve(beer())));

        // A display destination can still be reached.
        DispatchReport report = dispatch(service, resolve(burger())).join();
        assertEquals(DeliveryStatus.PUBLISHED, report.outcome(StationId.of("grill-kds")).orElseThrow().status());
    }

    @Test
    void shutdownRefusesNewWork() {
        DispatchService service = service();

        assertTrue(service.shutdown(Duration.ZERO));
        assertTrue(service.isClosed());
        assertThrows(DispatchUnavailableException.class, () -> dispatch(service, resolve(burger())));
    }

    @Test
    void shutdownAbandonsDeliveriesThatDoNotDrain() {
        transport.always(BAR_HOST, Reply.REFUSE);
        DispatchService service = service();
        CompletableFuture<DispatchReport> future = dispatch(service, resolve(beer()));

        assertFalse(service.shutdown(Duration.ofMillis(20)));

        DestinationOutcome bar = future.join().outcomes().get(0);
        assertEquals(DeliveryStatus.FAILED, bar.status());
        assertEquals(1, alerts.alerts().size());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void attemptThatFailsAfterShutdownDoesNotFailOver() {
        transport.always(GRILL_HOST, Reply.HANG);
        DispatchService service = service(RetryPolicy.noRetry(Duration.ofSeconds(1)));
        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger()));

        assertFalse(service.shutdown(Duration.ofMillis(20)));
        transport.hanging().get(0).completeExceptionally(new PrinterTransportException("Connection reset"));

        DestinationOutcome grill = future.join().outcome(StationId.of("grill-printer")).orElseThrow();
        assertEquals(DeliveryStatus.FAILED, grill.status());
        assertEquals(1, sink.eventsOfType(PrintJobTerminalEvent.class).size());
        assertEquals(1, alerts.alerts().size());
        assertEquals(0, transport.sentTo(EXPO_HOST));
    }

    @Test
    void acknowledgementAfterShutdownKeepsTheJobFailed() {
        transport.always(BAR_HOST, Reply.HANG);
        DispatchService service = service(RetryPolicy.noRetry(Duration.ofSeconds(1)));
        CompletableFuture<DispatchReport> future = dispatch(service, resolve(beer()));

        assertFalse(service.shutdown(Duration.ofMillis(20)));
        transport.hanging().get(0).complete(PrinterAck.online());

        assertEquals(DeliveryStatus.FAILED, future.join().outcomes().get(0).status());
        List<PrintJobTerminalEvent> terminal = sink.eventsOfType(PrintJobTerminalEvent.class);
        assertEquals(1, terminal.size());
        assertEquals(PrintJobState.FAILED, terminal.get(0).state());
        assertEquals(CancellationNote.Kind.ALREADY_FAILED,
                service.cancelOrder("order-1").notes().get(0).kind());
    }

    @Test
    void executorRejectingPartWayReportsTheRemainingDestinationsAsFailed() {
        AtomicInteger submitted = new AtomicInteger();
        AtomicInteger depth = new AtomicInteger();
        // accepts the first destination and the work it spawns, rejects the next fan-out task
        Executor oneDestination = r -> {
            if (depth.get() == 0 && submitted.incrementAndGet() > 1) {
                throw new RejectedExecutionException("queue full");
            }
            depth.incrementAndGet();
            try {
                r.run();
            }
            finally {
                depth.decrementAndGet();
            }
        };
        DispatchService service = service(RetryPolicy.defaults(), oneDestination);

        CompletableFuture<DispatchReport> future = dispatch(service, resolve(burger(), beer()));

        assertTrue(future.isDone());
        DispatchReport report = future.join();
        assertEquals(3, report.outcomes().size());
        assertNotEquals(DeliveryStatus.FAILED, report.outcomes().get(0).status());
        assertEquals(DeliveryStatus.FAILED, report.outcomes().get(1).status());
        assertEquals(DeliveryStatus.FAILED, report.outcomes().get(2).status());
        assertEquals(DispatchReport.Status.PARTIALLY_SENT, report.status());
        assertTrue(sink.hasEventOfType(RoutingErrorEvent.class));
        assertTrue(service.progress("order-1").isEmpty());
    }

    @Test
    void executorRejectingEverythingRefusesTheDispatch() {
        DispatchService service = service(RetryPolicy.defaults(), r -> {
            throw new RejectedExecutionException("stopped");
        });

        assertThrows(DispatchUnavailableException.class, () -> dispatch(service, resolve(burger(), beer())));
        assertTrue(service.progress("order-1").isEmpty());
    }

    @Test
    void unroutedOrderIsNotSent() {
        DispatchService service = service();
        OrderItem mystery = OrderItem.builder("i-x", "Mystery").tags("nowhere").build();

        DispatchReport report = dispatch(service, resolve(mystery)).join();

        assertEquals(DispatchReport.Status.NOT_SENT, report.status());
        assertTrue(report.outcomes().isEmpty());
        assertEquals(1, report.unrouted().size());
    }
}
