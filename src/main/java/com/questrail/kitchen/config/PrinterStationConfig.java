package com.questrail.kitchen.config;

import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.print.TicketLayout;

import java.net.InetSocketAddress;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Hardware and layout settings of one printer station.
 *
 * <p>{@code timeZone} is used for the ticket timestamp only.</p>
 */
public record PrinterStationConfig(
        StationId stationId,
        InetSocketAddress address,
        PrinterType printerType,
        PaperWidth paperWidth,
        TicketLayout layout,
        ZoneId timeZone
) {
    /** Raw TCP port most network receipt printers listen on. */
    public static final int DEFAULT_PORT = 9100;

    public PrinterStationConfig {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(printerType, "printerType");
        Objects.requireNonNull(paperWidth, "paperWidth");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(timeZone, "timeZone");
    }

    public static Builder builder(String stationId) {
        return new Builder().withStationId(StationId.of(stationId));
    }

    public PrinterStationConfig withLayout(TicketLayout layout) {
        return new PrinterStationConfig(stationId, address, printerType, paperWidth, layout, timeZone);
    }

    public static final class Builder {
        private StationId stationId;
        private InetSocketAddress address;
        private PrinterType printerType = PrinterType.THERMAL;
        private PaperWidth paperWidth = PaperWidth.MM_80;
        private TicketLayout layout = TicketLayout.kitchen();
        private ZoneId timeZone = ZoneId.systemDefault();

        public Builder withStationId(StationId stationId) {
            this.stationId = stationId;
            return this;
        }

        public Builder withAddress(InetSocketAddress address) {
            this.address = address;
            return this;
        }

        public Builder withHost(String host) {
            return withHost(host, DEFAULT_PORT);
        }

        public Builder withHost(String host, int port) {
            this.address = InetSocketAddress.createUnresolved(host, port);
            return this;
        }

        public Builder withPrinterType(PrinterType printerType) {
            this.printerType = printerType;
            return this;
        }

        public Builder withPaperWidth(PaperWidth paperWidth) {
            this.paperWidth = paperWidth;
            return this;
        }

        public Builder withLayout(TicketLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder withTimeZone(ZoneId timeZone) {
            this.timeZone = timeZone;
            return this;
        }

        public PrinterStationConfig build() {
            return new PrinterStationConfig(stationId, address, printerType, paperWidth, layout, timeZone);
        }
    }
}
