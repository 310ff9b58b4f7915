package com.questrail.kitchen.api;

/**
 * Counters describing one resolution.
 *
 * @param totalItems    items in the snapshot
 * @param skippedItems  items skipped because they were already sent
 * @param routedItems   items delivered to at least one station
 * @param unroutedItems items in the unrouted bucket
 * @param stationsUsed  number of manifest entries
 */
public record RoutingStats(int totalItems, int skippedItems, int routedItems, int unroutedItems, int stationsUsed)
{
    public RoutingStats {
        if (totalItems < 0 || skippedItems < 0 || routedItems < 0 || unroutedItems < 0 || stationsUsed < 0) {
            throw new IllegalArgumentException("counters must be >= 0");
        }
        if (skippedItems + routedItems + unroutedItems != totalItems) {
            throw new IllegalArgumentException("skipped + routed + unrouted must equal total");
        }
    }
}
