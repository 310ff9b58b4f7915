package com.questrail.kitchen.api;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Items routed to one station for one send action.
 *
 * <p>{@code items} preserves the order in which the items were entered.
 * {@code matchedTags} is the union of tags through which any item matched this
 * station. {@code referenceItems} holds the other items of the send action,
 * shown for context; it is empty unless the station asks for reference items.</p>
 */
public record RoutingManifestEntry(
        StationId stationId,
        String stationName,
        StationKind kind,
        List<OrderItem> items,
        Set<RouteTag> matchedTags,
        List<OrderItem> referenceItems
) {
    public RoutingManifestEntry {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(stationName, "stationName");
        Objects.requireNonNull(kind, "kind");
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        matchedTags = RouteTags.copyOf(matchedTags);
        referenceItems = List.copyOf(Objects.requireNonNull(referenceItems, "referenceItems"));
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Manifest entry for " + stationId + " has no items");
        }
    }

    public boolean contains(String itemId) {
        for (OrderItem item : items) {
            if (item.id().equals(itemId)) {
                return true;
            }
        }
        return false;
    }
}
