package com.questrail.kitchen.runtime;

import com.questrail.kitchen.api.OrderContext;
import com.questrail.kitchen.api.OrderItem;
import com.questrail.kitchen.api.OrderSnapshot;
import com.questrail.kitchen.api.RouteTag;
import com.questrail.kitchen.api.Station;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.channel.StationMessage;
import com.questrail.kitchen.channel.StationSubscription;
import com.questrail.kitchen.config.KitchenRuntimeConfig;
import com.questrail.kitchen.config.PrinterStationConfig;
import com.questrail.kitchen.dispatch.DeliveryStatus;
import com.questrail.kitchen.dispatch.DispatchReport;
import com.questrail.kitchen.dispatch.DispatchUnavailableException;
import com.questrail.kitchen.dispatch.RecordingAlertChannel;
import com.questrail.kitchen.observability.ConfigurationWarningEvent;
import com.questrail.kitchen.observability.ManifestResolvedEvent;
import com.questrail.kitchen.observability.RecordingObservabilitySink;
import com.questrail.kitchen.registry.ConfigurationWarning;
import com.questrail.kitchen.registry.StationRegistry;
import com.questrail.kitchen.registry.TagRegistry;
import com.questrail.kitchen.time.DeterministicScheduler;
import com.questrail.kitchen.time.FixedWallClock;
import com.questrail.kitchen.time.ManualMonotonicClock;
import com.questrail.kitchen.transport.FakePrinterTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KitchenDispatchContextTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final FakePrinterTransport transport = new FakePrinterTransport();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RecordingAlertChannel alerts = new RecordingAlertChannel();

    private StationRegistry stations;
    private KitchenDispatchContext context;

    @BeforeEach
    void setUp() {
        stations = new StationRegistry(List.of(
                Station.display("grill-kds", "Grill KDS").tags("grill").build(),
                Station.printer("grill-printer", "Grill Printer").tags("grill").build(),
                Station.printer("bar-printer", "Bar Printer").tags("bar").build()));

        KitchenRuntimeConfig config = KitchenRuntimeConfig.builder()
                .withPrinter(PrinterStationConfig.builder("grill-printer").withHost("10.0.0.20").build())
                .withPrinter(PrinterStationConfig.builder("bar-printer").withHost("10.0.0.40").build())
                .withDrainTimeout(Duration.ofMillis(50))
                .build();

        context = KitchenDispatchContext.builder()
                .withConfig(config)
                .withStationRegistry(stations)
                .withTransport(transport)
                .withObservabilitySink(sink)
                .withAlerts(alerts)
                .withClock(clock)
                .withWallClock(new FixedWallClock())
                .withExecutor(Runnable::run)
                .withScheduler(new DeterministicScheduler(clock))
                .build();
        context.start();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private static OrderSnapshot order(String orderId, OrderItem... items) {
        return OrderSnapshot.of(OrderContext.of(orderId, Instant.parse("2024-05-17T18:30:00Z")), items);
    }

    private static OrderItem burger() {
        return OrderItem.builder("i-burger", "Burger").tags("grill").build();
    }

    private static OrderItem beer() {
        return OrderItem.builder("i-beer", "Beer").tags("bar").build();
    }

    @Test
    void sendRoutesAndDeliversEveryDestination() throws InterruptedException {
        StationSubscription kds = context.subscribe(StationId.of("grill-kds"));

        SendResult result = context.send(order("order-1", burger(), beer()));

        assertEquals(DispatchReport.Status.SENT, result.status());
        assertEquals(3, result.manifest().entries().size());
        assertEquals(DeliveryStatus.DELIVERED,
                result.report().outcome(StationId.of("bar-printer")).orElseThrow().status());
        assertEquals(1, transport.sentTo("10.0.0.20"));
        assertEquals(1, transport.sentTo("10.0.0.40"));

        StationMessage message = kds.poll(Duration.ofMillis(100));
        assertNotNull(message);
        assertEquals("Burger", message.entry().items().get(0).name());

        assertEquals(1, sink.eventsOfType(ManifestResolvedEvent.class).size());
    }

    @Test
    void multiLineAllergyNoteStillReachesEveryStation() {
        StationSubscription kds = context.subscribe(StationId.of("grill-kds"));
        OrderItem burger = OrderItem.builder("i-burger", "Burger")
                .tags("grill")
                .specialNotes("Nut allergy\nno sesame bun")
                .build();

        SendResult result = context.send(order("order-11", burger, beer()));

        assertEquals(DispatchReport.Status.SENT, result.status());
        assertEquals(1, transport.sentTo("10.0.0.20"));
        assertEquals(1, transport.sentTo("10.0.0.40"));
        assertEquals(1, kds.drain().size());
    }

    @Test
    void registryChangesApplyToTheNextSend() {
        context.stations().setActive(StationId.of("grill-printer"), false);

        SendResult result = context.send(order("order-2", burger()));

        assertTrue(result.report().outcome(StationId.of("grill-printer")).isEmpty());
        assertEquals(0, transport.sentTo("10.0.0.20"));
    }

    @Test
    void configurationWarningsAreReportedOncePerRegistryVersion() {
        stations.upsert(Station.printer("pizza-printer", "Pizza Printer").tags("wood-oven").build());

        context.resolve(order("order-3", burger()));
        context.resolve(order("order-4", burger()));

        List<ConfigurationWarningEvent> warnings = sink.eventsOfType(ConfigurationWarningEvent.class);
        assertEquals(1, warnings.size());
        assertEquals(ConfigurationWarning.Kind.UNKNOWN_TAG, warnings.get(0).warning().kind());
        assertEquals(RouteTag.of("wood-oven"), warnings.get(0).warning().routeTag().orElseThrow());

        stations.upsert(Station.printer("pizza-printer", "Pizza Printer").tags("wood-oven", "pizza").build());
        context.resolve(order("order-5", burger()));

        assertEquals(2, sink.eventsOfType(ConfigurationWarningEvent.class).size());
    }

    @Test
    void resolvingDoesNotDispatch() {
        context.resolve(order("order-6", beer()));

        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void cancellationReachesTheDispatchService() {
        context.send(order("order-7", beer()));

        assertEquals(1, context.cancelOrder("order-7").notes().size());
    }

    @Test
    void closedContextRefusesSends() {
        StationSubscription kds = context.subscribe(StationId.of("grill-kds"));

        context.close();

        assertTrue(context.isClosed());
        assertTrue(kds.isClosed());
        assertFalse(transport.isRunning());
        assertThrows(DispatchUnavailableException.class, () -> context.send(order("order-8", burger())));
    }

    @Test
    void contextRunsOnItsOwnThreadsWhenNoneAreSupplied() {
        FakePrinterTransport fake = new FakePrinterTransport();
        try (KitchenDispatchContext owned = KitchenDispatchContext.builder()
                .withConfig(KitchenRuntimeConfig.builder()
                        .withPrinter(PrinterStationConfig.builder("bar-printer").withHost("10.0.0.40").build())
                        .build())
                .withStationRegistry(stations)
                .withTransport(fake)
                .withObservabilitySink(sink)
                .build()) {
            owned.start();

            SendResult result = owned.send(order("order-9", beer()));

            assertEquals(DispatchReport.Status.SENT, result.status());
        }
    }

    @Test
    void asyncSendUsesTheSuppliedTagRegistry() {
        TagRegistry drinksOnly = TagRegistry.builder().define("bar", "Drinks").build();
        try (KitchenDispatchContext bar = KitchenDispatchContext.builder()
                .withTagRegistry(drinksOnly)
                .withStationRegistry(stations)
                .withTransport(transport)
                .withObservabilitySink(sink)
                .withExecutor(Runnable::run)
                .withScheduler(new DeterministicScheduler(clock))
                .withClock(clock)
                .withWallClock(new FixedWallClock())
                .build()) {
            bar.start();

            SendResult result = bar.sendAsync(order("order-10", burger())).join();

            assertSame(drinksOnly, bar.tags());
            assertEquals(1, result.manifest().unknownTags().size());
            assertFalse(bar.dispatchService().isClosed());
            // grill-printer has no printer settings in this context
            assertEquals(DeliveryStatus.BUILD_FAILED,
                    result.report().outcome(StationId.of("grill-printer")).orElseThrow().status());
            assertEquals(DispatchReport.Status.PARTIALLY_SENT, result.status());
        }
    }

    @Test
    void stationRegistryIsRequired() {
        assertThrows(NullPointerException.class, () -> KitchenDispatchContext.builder().build());
    }
}
