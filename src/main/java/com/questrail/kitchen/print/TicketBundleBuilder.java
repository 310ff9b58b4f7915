package com.questrail.kitchen.print;

import com.questrail.kitchen.api.OrderContext;
import com.questrail.kitchen.api.RoutingManifest;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.api.StationKind;
import com.questrail.kitchen.config.PrinterStationConfig;
import com.questrail.kitchen.print.codec.impl.PrinterEncoders;
import com.questrail.kitchen.print.codec.impl.UnsupportedPrinterCommandException;
import com.questrail.kitchen.print.model.PrintTicket;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds and encodes the tickets of every printer entry in a manifest.
 *
 * <p>A failure, expected or not, is recorded against its station and never
 * stops the other entries.</p>
 */
public final class TicketBundleBuilder
{
    private final PrintTemplateFactory factory;
    private final Function<StationId, PrinterStationConfig> printers;

    public TicketBundleBuilder(PrintTemplateFactory factory, Function<StationId, PrinterStationConfig> printers) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.printers = Objects.requireNonNull(printers, "printers");
    }

    public TicketBundle build(RoutingManifest manifest) {
        Objects.requireNonNull(manifest, "manifest");

        Map<StationId, PreparedTicket> tickets = new LinkedHashMap<>();
        Map<StationId, TicketBuildFailure> failures = new LinkedHashMap<>();

        for (RoutingManifestEntry entry : manifest.entries()) {
            if (entry.kind() != StationKind.PRINTER) {
                continue;
            }
            PrinterStationConfig config = printers.apply(entry.stationId());
            if (config == null) {
                failures.put(entry.stationId(), new TicketBuildFailure(entry.stationId(),
                        "No printer configuration for station " + entry.stationId(), null));
                continue;
            }
            try {
                tickets.put(entry.stationId(), prepare(entry, manifest.context(), config));
            }
            catch (TicketBuildException e) {
                failures.put(entry.stationId(), new TicketBuildFailure(entry.stationId(), e.getMessage(), e));
            }
            catch (RuntimeException e) {
                failures.put(entry.stationId(), new TicketBuildFailure(entry.stationId(),
                        "Unexpected error building ticket: " + e, e));
            }
        }
        return new TicketBundle(tickets, failures);
    }

    /**
     * Builds and encodes one entry for one printer.
     *
     * @throws TicketBuildException if the layout is malformed or the printer cannot print a style
     */
    public PreparedTicket prepare(RoutingManifestEntry entry, OrderContext order, PrinterStationConfig config) {
        PrintTicket ticket = factory.buildTicket(entry, order, config);
        try {
            byte[] payload = PrinterEncoders.forType(config.printerType()).encode(ticket);
            return new PreparedTicket(entry.stationId(), config, ticket, payload);
        }
        catch (UnsupportedPrinterCommandException e) {
            throw new TicketBuildException(e.getMessage(), e);
        }
    }
}
