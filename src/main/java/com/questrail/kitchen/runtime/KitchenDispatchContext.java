package com.questrail.kitchen.runtime;

import com.questrail.kitchen.api.OrderSnapshot;
import com.questrail.kitchen.api.RoutingManifest;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.channel.StationChannelHub;
import com.questrail.kitchen.channel.StationSubscription;
import com.questrail.kitchen.config.KitchenRuntimeConfig;
import com.questrail.kitchen.dispatch.CancellationResult;
import com.questrail.kitchen.dispatch.DispatchService;
import com.questrail.kitchen.dispatch.OperatorAlertChannel;
import com.questrail.kitchen.dispatch.Slf4jOperatorAlertChannel;
import com.questrail.kitchen.internal.time.MonotonicClock;
import com.questrail.kitchen.internal.time.MonotonicScheduler;
import com.questrail.kitchen.internal.time.ScheduledExecutorScheduler;
import com.questrail.kitchen.internal.time.SystemMonotonicClock;
import com.questrail.kitchen.internal.time.SystemWallClock;
import com.questrail.kitchen.internal.time.WallClock;
import com.questrail.kitchen.observability.ConfigurationWarningEvent;
import com.questrail.kitchen.observability.ManifestResolvedEvent;
import com.questrail.kitchen.observability.RoutingObservabilitySink;
import com.questrail.kitchen.observability.Slf4jRoutingObservabilitySink;
import com.questrail.kitchen.print.PrintTemplateFactory;
import com.questrail.kitchen.print.TicketBundle;
import com.questrail.kitchen.print.TicketBundleBuilder;
import com.questrail.kitchen.registry.ConfigurationWarning;
import com.questrail.kitchen.registry.RegistrySnapshot;
import com.questrail.kitchen.registry.StationRegistry;
import com.questrail.kitchen.registry.TagRegistry;
import com.questrail.kitchen.routing.RoutingResolver;
import com.questrail.kitchen.transport.PrinterTransport;
import com.questrail.kitchen.transport.netty.NettyTcpPrinterTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * KitchenDispatchContext
 * =============================================================================
 * Composition root and lifecycle owner of the routing and dispatch stack.
 *
 * <p>One context per process. It owns the station channels, the printer
 * transport and the dispatch threads; the tag and station registries are
 * supplied by the caller and may be mutated while the context runs. A
 * mutation only affects sends that start after it.</p>
 *
 * <p>{@link #close()} stops intake, drains in-flight deliveries for the
 * configured drain timeout, then releases the transport and the threads.</p>
 */
public final class KitchenDispatchContext implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(KitchenDispatchContext.class);

    private final KitchenRuntimeConfig config;
    private final TagRegistry tagRegistry;
    private final StationRegistry stationRegistry;
    private final RoutingResolver resolver;
    private final TicketBundleBuilder tickets;
    private final StationChannelHub hub;
    private final PrinterTransport transport;
    private final DispatchService dispatch;
    private final RoutingObservabilitySink sink;
    private final WallClock wallClock;
    private final ExecutorService ownedDispatchExecutor;
    private final ScheduledExecutorService ownedSchedulerExecutor;

    private final AtomicLong warnedVersion = new AtomicLong(-1);
    private final AtomicBoolean closed = new AtomicBoolean();

    private KitchenDispatchContext(
            KitchenRuntimeConfig config,
            TagRegistry tagRegistry,
            StationRegistry stationRegistry,
            TicketBundleBuilder tickets,
            StationChannelHub hub,
            PrinterTransport transport,
            DispatchService dispatch,
            RoutingObservabilitySink sink,
            WallClock wallClock,
            ExecutorService ownedDispatchExecutor,
            ScheduledExecutorService ownedSchedulerExecutor) {
        this.config = config;
        this.tagRegistry = tagRegistry;
        this.stationRegistry = stationRegistry;
        this.resolver = new RoutingResolver();
        this.tickets = tickets;
        this.hub = hub;
        this.transport = transport;
        this.dispatch = dispatch;
        this.sink = sink;
        this.wallClock = wallClock;
        this.ownedDispatchExecutor = ownedDispatchExecutor;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;
    }

    public void start() {
        transport.start();
        log.info("Kitchen dispatch started ({} printer(s) configured)", config.printers().size());
    }

    /**
     * Routes and delivers the newly sent items of an order, waiting until
     * every destination is terminal.
     *
     * @throws com.questrail.kitchen.dispatch.DispatchUnavailableException if nothing can be dispatched
     */
    public SendResult send(OrderSnapshot order) {
        RoutingManifest manifest = resolve(order);
        TicketBundle bundle = tickets.build(manifest);
        return new SendResult(manifest, dispatch.dispatch(manifest, bundle));
    }

    /**
     * Resolves synchronously, then delivers in the background.
     */
    public CompletableFuture<SendResult> sendAsync(OrderSnapshot order) {
        RoutingManifest manifest = resolve(order);
        TicketBundle bundle = tickets.build(manifest);
        return dispatch.dispatchAsync(manifest, bundle).thenApply(report -> new SendResult(manifest, report));
    }

    /**
     * Resolves an order against the current registries without dispatching it.
     */
    public RoutingManifest resolve(OrderSnapshot order) {
        Objects.requireNonNull(order, "order");
        RegistrySnapshot snapshot = stationRegistry.snapshot();
        reportConfigurationWarnings(snapshot);

        RoutingManifest manifest = resolver.resolve(order, tagRegistry, snapshot);
        sink.onManifestResolved(new ManifestResolvedEvent(wallClock.now(), manifest));
        return manifest;
    }

    public CancellationResult cancelOrder(String orderId) {
        return dispatch.cancelOrder(orderId);
    }

    public CancellationResult cancelItems(String orderId, Set<String> itemIds) {
        return dispatch.cancelItems(orderId, itemIds);
    }

    public StationSubscription subscribe(StationId stationId) {
        return hub.subscribe(stationId);
    }

    public StationChannelHub channels() {
        return hub;
    }

    public StationRegistry stations() {
        return stationRegistry;
    }

    public TagRegistry tags() {
        return tagRegistry;
    }

    public DispatchService dispatchService() {
        return dispatch;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean drained = dispatch.shutdown(config.drainTimeout());
        if (!drained) {
            log.warn("Deliveries still open after drain timeout {} were abandoned", config.drainTimeout());
        }
        hub.closeAll();
        transport.stop();
        shutdown(ownedSchedulerExecutor);
        shutdown(ownedDispatchExecutor);
        log.info("Kitchen dispatch stopped");
    }

    private void reportConfigurationWarnings(RegistrySnapshot snapshot) {
        long version = snapshot.version();
        long previous = warnedVersion.get();
        if (previous == version || !warnedVersion.compareAndSet(previous, version)) {
            return;
        }
        for (ConfigurationWarning warning : snapshot.configurationWarnings(tagRegistry)) {
            sink.onConfigurationWarning(new ConfigurationWarningEvent(wallClock.now(), version, warning));
        }
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private KitchenRuntimeConfig config = KitchenRuntimeConfig.defaults();
        private TagRegistry tagRegistry = TagRegistry.defaults();
        private StationRegistry stationRegistry;
        private PrinterTransport transport;
        private RoutingObservabilitySink sink = new Slf4jRoutingObservabilitySink();
        private OperatorAlertChannel alerts = new Slf4jOperatorAlertChannel();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Executor executor;
        private MonotonicScheduler scheduler;

        public Builder withConfig(KitchenRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTagRegistry(TagRegistry tagRegistry) {
            this.tagRegistry = tagRegistry;
            return this;
        }

        public Builder withStationRegistry(StationRegistry stationRegistry) {
            this.stationRegistry = stationRegistry;
            return this;
        }

        /**
         * Replaces the Netty printer transport.
         */
        public Builder withTransport(PrinterTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(RoutingObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withAlerts(OperatorAlertChannel alerts) {
            this.alerts = alerts;
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

        /**
         * Runs destination tasks on a caller-owned executor instead of an
         * internal pool. The context never shuts it down.
         */
        public Builder withExecutor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Schedules timeouts and backoff on a caller-owned scheduler.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public KitchenDispatchContext build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(tagRegistry, "tagRegistry");
            Objects.requireNonNull(stationRegistry, "stationRegistry");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(alerts, "alerts");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            // 1. Threads
            ExecutorService ownedDispatch = null;
            Executor dispatchExecutor = executor;
            if (dispatchExecutor == null) {
                ownedDispatch = Executors.newFixedThreadPool(config.dispatchThreads());
                dispatchExecutor = ownedDispatch;
            }
            ScheduledExecutorService ownedScheduler = null;
            MonotonicScheduler timing = scheduler;
            if (timing == null) {
                ownedScheduler = Executors.newScheduledThreadPool(1);
                timing = new ScheduledExecutorScheduler(ownedScheduler, clock);
            }

            // 2. Outbound paths
            PrinterTransport printerTransport = transport != null
                    ? transport
                    : new NettyTcpPrinterTransport(config.connectTimeout());
            StationChannelHub hub = new StationChannelHub(wallClock, config.channelCapacity());

            // 3. Tickets
            TicketBundleBuilder tickets = new TicketBundleBuilder(new PrintTemplateFactory(), config.printers()::get);

            // 4. Dispatch
            StationRegistry registry = stationRegistry;
            DispatchService dispatch = DispatchService.builder()
                    .withTransport(printerTransport)
                    .withChannelHub(hub)
                    .withTicketBuilder(tickets)
                    .withPrinters(config.printers()::get)
                    .withRegistry(registry::snapshot)
                    .withRetryPolicy(config.retryPolicy())
                    .withExecutor(dispatchExecutor)
                    .withScheduler(timing)
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withAlerts(alerts)
                    .withObservabilitySink(sink)
                    .withRetainedOrders(config.retainedOrders())
                    .build();

            return new KitchenDispatchContext(config, tagRegistry, stationRegistry, tickets, hub,
                    printerTransport, dispatch, sink, wallClock, ownedDispatch, ownedScheduler);
        }
    }
}
