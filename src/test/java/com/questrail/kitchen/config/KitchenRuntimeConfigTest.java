package com.questrail.kitchen.config;

import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.dispatch.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class KitchenRuntimeConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        KitchenRuntimeConfig config = KitchenRuntimeConfig.defaults();

        assertEquals(RetryPolicy.defaults(), config.retryPolicy());
        assertEquals(Duration.ofSeconds(10), config.drainTimeout());
        assertEquals(4, config.dispatchThreads());
        assertEquals(64, config.channelCapacity());
        assertEquals(500, config.retainedOrders());
        assertTrue(config.printers().isEmpty());
    }

    @Test
    void laterPrinterSettingsReplaceEarlierOnes() {
        KitchenRuntimeConfig config = KitchenRuntimeConfig.builder()
                .withPrinter(PrinterStationConfig.builder("grill-printer").withHost("10.0.0.20").build())
                .withPrinter(PrinterStationConfig.builder("grill-printer").withHost("10.0.0.21", 9101)
                        .withPrinterType(PrinterType.IMPACT).build())
                .build();

        PrinterStationConfig grill = config.printer(StationId.of("grill-printer")).orElseThrow();
        assertEquals("10.0.0.21", grill.address().getHostString());
        assertEquals(9101, grill.address().getPort());
        assertEquals(PrinterType.IMPACT, grill.printerType());
        assertTrue(config.printer(StationId.of("bar-printer")).isEmpty());
    }

    @Test
    void printerSettingsDefaultToThermalOnPort9100() {
        PrinterStationConfig config = PrinterStationConfig.builder("bar-printer").withHost("10.0.0.40").build();

        assertEquals(PrinterStationConfig.DEFAULT_PORT, config.address().getPort());
        assertEquals(PrinterType.THERMAL, config.printerType());
        assertEquals(PaperWidth.MM_80, config.paperWidth());
    }

    @Test
    void printerWithoutAddressIsRejected() {
        assertThrows(NullPointerException.class, () -> PrinterStationConfig.builder("bar-printer").build());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> KitchenRuntimeConfig.builder().withDispatchThreads(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> KitchenRuntimeConfig.builder().withChannelCapacity(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> KitchenRuntimeConfig.builder().withDrainTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> KitchenRuntimeConfig.builder().withConnectTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> KitchenRuntimeConfig.builder().withRetainedOrders(0).build());
    }
}
