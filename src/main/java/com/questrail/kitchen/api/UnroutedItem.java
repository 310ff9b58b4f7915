package com.questrail.kitchen.api;

import java.util.Objects;
import java.util.Set;

/**
 * An item that matched no active station. Unrouted items are reported, never
 * delivered, so operators can fix the tag configuration.
 */
public record UnroutedItem(OrderItem item, Set<RouteTag> effectiveTags, TagSource source, Reason reason)
{
    public enum Reason {
        /** Effective tag set is empty. */
        NO_TAGS,
        /** Effective tags intersect no active station's subscription. */
        NO_MATCHING_STATION
    }

    public UnroutedItem {
        Objects.requireNonNull(item, "item");
        effectiveTags = RouteTags.copyOf(effectiveTags);
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(reason, "reason");
    }
}
