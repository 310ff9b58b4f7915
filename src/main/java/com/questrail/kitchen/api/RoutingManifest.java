package com.questrail.kitchen.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RoutingManifest
 * -----------------------------------------------------------------------------
 * The resolver's output for one send action.
 *
 * <ul>
 *   <li>one entry per station that receives at least one item, in station
 *       registry order</li>
 *   <li>the unrouted bucket, in item order</li>
 *   <li>unknown tag diagnostics</li>
 *   <li>the version of the station registry snapshot that was used</li>
 * </ul>
 *
 * <p>The manifest is an immutable value created per send action. It is never
 * persisted by this engine.</p>
 */
public record RoutingManifest(
        OrderContext context,
        List<RoutingManifestEntry> entries,
        List<UnroutedItem> unrouted,
        List<TagDiagnostic> unknownTags,
        RoutingStats stats,
        long registryVersion
) {
    public RoutingManifest {
        Objects.requireNonNull(context, "context");
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        unrouted = List.copyOf(Objects.requireNonNull(unrouted, "unrouted"));
        unknownTags = List.copyOf(Objects.requireNonNull(unknownTags, "unknownTags"));
        Objects.requireNonNull(stats, "stats");
    }

    public String orderId() {
        return context.orderId();
    }

    public Optional<RoutingManifestEntry> entryFor(StationId stationId) {
        for (RoutingManifestEntry e : entries) {
            if (e.stationId().equals(stationId)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    public boolean isFullyUnrouted() {
        return entries.isEmpty();
    }
}
