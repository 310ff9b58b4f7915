package com.questrail.kitchen.observability;

import com.questrail.kitchen.api.RoutingManifest;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.api.TagDiagnostic;
import com.questrail.kitchen.api.UnroutedItem;
import com.questrail.kitchen.dispatch.DestinationOutcome;
import com.questrail.kitchen.dispatch.DispatchReport;
import com.questrail.kitchen.dispatch.PrintJobState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RoutingObservabilitySink that emits logs via SLF4J.
 *
 * <p>Unrouted items, unknown tags and configuration problems are WARN so they
 * show up without debug logging; a routine send is one INFO line.</p>
 */
public final class Slf4jRoutingObservabilitySink implements RoutingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRoutingObservabilitySink.class);

    @Override
    public void onManifestResolved(ManifestResolvedEvent event) {
        RoutingManifest m = event.manifest();
        log.info("Order {}: {} item(s) routed to {} station(s), {} unrouted, {} skipped (registry v{})",
                m.orderId(),
                m.stats().routedItems(),
                m.stats().stationsUsed(),
                m.stats().unroutedItems(),
                m.stats().skippedItems(),
                m.registryVersion());

        if (log.isDebugEnabled()) {
            for (RoutingManifestEntry e : m.entries()) {
                log.debug("Order {} -> {} [{}] items={} matched={}",
                        m.orderId(), e.stationName(), e.kind(), e.items(), e.matchedTags());
            }
        }
        if (event.hasUnrouted()) {
            for (UnroutedItem u : m.unrouted()) {
                log.warn("Order {}: item '{}' ({}) unrouted: {} (tags {} from {})",
                        m.orderId(), u.item().name(), u.item().id(), u.reason(), u.effectiveTags(), u.source());
            }
        }
        for (TagDiagnostic d : m.unknownTags()) {
            log.warn("Order {}: item '{}' uses unknown tag '{}' ({} tag)",
                    m.orderId(), d.itemName(), d.tag(), d.source());
        }
    }

    @Override
    public void onConfigurationWarning(ConfigurationWarningEvent event) {
        log.warn("Station registry v{}: {} - {}",
                event.registryVersion(), event.warning().kind(), event.warning().message());
    }

    @Override
    public void onPrintJobTerminal(PrintJobTerminalEvent event) {
        if (event.state() == PrintJobState.ACKNOWLEDGED) {
            log.debug("Print job {} for station {} acknowledged after {} attempt(s)",
                    event.jobId(), event.target(), event.attempts().size());
        }
        else {
            log.warn("Print job {} (order {}, station {}, target {}) ended {} after {} attempt(s): {}",
                    event.jobId(), event.orderId(), event.stationId(), event.target(),
                    event.state(), event.attempts().size(), event.attempts());
        }
    }

    @Override
    public void onDispatchCompleted(DispatchCompletedEvent event) {
        DispatchReport r = event.report();
        if (r.status() == DispatchReport.Status.SENT) {
            log.info("Order {} dispatched: {} destination(s) {}", r.orderId(), r.outcomes().size(), r.status());
            return;
        }
        log.warn("Order {} dispatched: {}", r.orderId(), r.status());
        for (DestinationOutcome o : r.failed()) {
            log.warn("  {} [{}]: {}{}", o.stationName(), o.stationId(), o.status(),
                    o.details().map(d -> " - " + d).orElse(""));
        }
    }

    @Override
    public void onCancellationNote(CancellationNoteEvent event) {
        log.info("Order {} cancellation at station {}: {} - {}",
                event.note().orderId(), event.note().stationId(), event.note().kind(), event.note().message());
    }

    @Override
    public void onError(RoutingErrorEvent event) {
        log.error("Routing error{}: {}",
                event.order().map(o -> " (order " + o + ")").orElse(""), event.message(), event.cause());
    }
}
