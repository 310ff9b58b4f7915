package com.questrail.kitchen.config;

import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.dispatch.RetryPolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the kitchen dispatch runtime.
 *
 * @param drainTimeout     how long shutdown waits for in-flight deliveries
 * @param dispatchThreads  worker threads running destination tasks and attempt callbacks
 * @param channelCapacity  default queue size of a display station subscription
 * @param connectTimeout   TCP connect timeout towards printers
 * @param retainedOrders   recent orders whose print jobs stay available for cancellation
 */
public record KitchenRuntimeConfig(
        RetryPolicy retryPolicy,
        Duration drainTimeout,
        int dispatchThreads,
        int channelCapacity,
        Duration connectTimeout,
        int retainedOrders,
        Map<StationId, PrinterStationConfig> printers
) {
    public KitchenRuntimeConfig {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        if (dispatchThreads < 1) {
            throw new IllegalArgumentException("dispatchThreads must be >= 1 (was " + dispatchThreads + ")");
        }
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("channelCapacity must be >= 1 (was " + channelCapacity + ")");
        }
        if (retainedOrders < 1) {
            throw new IllegalArgumentException("retainedOrders must be >= 1 (was " + retainedOrders + ")");
        }
        printers = Map.copyOf(Objects.requireNonNull(printers, "printers"));
    }

    public static KitchenRuntimeConfig defaults() {
        return builder().build();
    }

    public Optional<PrinterStationConfig> printer(StationId stationId) {
        return Optional.ofNullable(printers.get(stationId));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration drainTimeout = Duration.ofSeconds(10);
        private int dispatchThreads = 4;
        private int channelCapacity = 64;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private int retainedOrders = 500;
        private final Map<StationId, PrinterStationConfig> printers = new LinkedHashMap<>();

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder withDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
            return this;
        }

        public Builder withChannelCapacity(int channelCapacity) {
            this.channelCapacity = channelCapacity;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withRetainedOrders(int retainedOrders) {
            this.retainedOrders = retainedOrders;
            return this;
        }

        /**
         * Adds or replaces the printer settings of one station.
         */
        public Builder withPrinter(PrinterStationConfig printer) {
            Objects.requireNonNull(printer, "printer");
            this.printers.put(printer.stationId(), printer);
            return this;
        }

        public KitchenRuntimeConfig build() {
            return new KitchenRuntimeConfig(retryPolicy, drainTimeout, dispatchThreads, channelCapacity,
                    connectTimeout, retainedOrders, printers);
        }
    }
}
