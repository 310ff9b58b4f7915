package com.questrail.kitchen.routing;

import com.questrail.kitchen.api.OrderItem;
import com.questrail.kitchen.api.OrderSnapshot;
import com.questrail.kitchen.api.RouteTag;
import com.questrail.kitchen.api.RouteTags;
import com.questrail.kitchen.api.RoutingManifest;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.api.RoutingStats;
import com.questrail.kitchen.api.Station;
import com.questrail.kitchen.api.TagDiagnostic;
import com.questrail.kitchen.api.UnroutedItem;
import com.questrail.kitchen.registry.EffectiveTags;
import com.questrail.kitchen.registry.RegistrySnapshot;
import com.questrail.kitchen.registry.TagRegistry;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * RoutingResolver
 * =============================================================================
 * Decides which stations receive which items of one send action.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Items whose sent flag is set are skipped. Re-sends only route the
 *       newly added items.</li>
 *   <li>Effective tags: the item's own tags if non-empty, else its category's
 *       tags, else empty.</li>
 *   <li>An item is routed to every active station whose subscription
 *       intersects its effective tags.</li>
 *   <li>Items matching nothing go to the unrouted bucket.</li>
 * </ol>
 *
 * <h2>Ordering</h2>
 * Entries follow station registry order. Items inside an entry follow input
 * order, never tag-match order. An item routed to several stations appears by
 * reference in each entry.
 *
 * <h2>Purity</h2>
 * No I/O and no state. Safe to call concurrently.
 */
public final class RoutingResolver
{
    public RoutingManifest resolve(OrderSnapshot order, TagRegistry tagRegistry, RegistrySnapshot registry) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(tagRegistry, "tagRegistry");
        Objects.requireNonNull(registry, "registry");

        List<Station> stations = registry.activeStations();

        // registry order
        Map<Station, List<OrderItem>> routed = new LinkedHashMap<>();
        Map<Station, Set<RouteTag>> matched = new LinkedHashMap<>();
        for (Station s : stations) {
            routed.put(s, new ArrayList<>());
            matched.put(s, new LinkedHashSet<>());
        }

        List<OrderItem> sending = new ArrayList<>();
        List<UnroutedItem> unrouted = new ArrayList<>();
        List<TagDiagnostic> unknown = new ArrayList<>();
        Map<OrderItem, Boolean> routedItems = new IdentityHashMap<>();
        int skipped = 0;

        for (OrderItem item : order.items()) {
            if (item.sent()) {
                skipped++;
                continue;
            }
            sending.add(item);

            EffectiveTags effective = tagRegistry.effectiveTags(item);
            for (RouteTag t : tagRegistry.unknownTags(effective.tags())) {
                unknown.add(new TagDiagnostic(item.id(), item.name(), t, effective.source()));
            }

            if (effective.isEmpty()) {
                unrouted.add(new UnroutedItem(item, effective.tags(), effective.source(), UnroutedItem.Reason.NO_TAGS));
                continue;
            }

            boolean any = false;
            for (Station s : stations) {
                Set<RouteTag> overlap = RouteTags.intersection(s.tags(), effective.tags());
                if (!overlap.isEmpty()) {
                    routed.get(s).add(item);
                    matched.get(s).addAll(overlap);
                    any = true;
                }
            }
            if (any) {
                routedItems.put(item, Boolean.TRUE);
            }
            else {
                unrouted.add(new UnroutedItem(item, effective.tags(), effective.source(),
                        UnroutedItem.Reason.NO_MATCHING_STATION));
            }
        }

        List<RoutingManifestEntry> entries = new ArrayList<>();
        for (Map.Entry<Station, List<OrderItem>> e : routed.entrySet()) {
            List<OrderItem> items = e.getValue();
            if (items.isEmpty()) {
                continue;
            }
            Station s = e.getKey();
            List<OrderItem> reference = s.showReferenceItems() ? referenceItems(sending, items) : List.of();
            entries.add(new RoutingManifestEntry(s.id(), s.name(), s.kind(), items, matched.get(s), reference));
        }

        RoutingStats stats = new RoutingStats(
                order.items().size(), skipped, routedItems.size(), unrouted.size(), entries.size());

        return new RoutingManifest(order.context(), entries, unrouted, unknown, stats, registry.version());
    }

    /**
     * Reports which of the given tag sets no active station would receive.
     *
     * <p>Used by configuration screens to check a menu before service.</p>
     */
    public RoutingValidation validateRouting(List<Set<RouteTag>> tagSets, RegistrySnapshot registry) {
        Objects.requireNonNull(tagSets, "tagSets");
        Objects.requireNonNull(registry, "registry");

        List<Integer> unrouted = new ArrayList<>();
        for (int i = 0; i < tagSets.size(); i++) {
            Set<RouteTag> tags = tagSets.get(i);
            if (tags == null || registry.stationsForTags(tags).isEmpty()) {
                unrouted.add(i);
            }
        }
        return new RoutingValidation(unrouted, registry.version());
    }

    private static List<OrderItem> referenceItems(List<OrderItem> sending, List<OrderItem> primary) {
        Map<OrderItem, Boolean> own = new IdentityHashMap<>();
        for (OrderItem i : primary) {
            own.put(i, Boolean.TRUE);
        }
        List<OrderItem> out = new ArrayList<>();
        for (OrderItem i : sending) {
            if (!own.containsKey(i)) {
                out.add(i);
            }
        }
        return out;
    }
}
