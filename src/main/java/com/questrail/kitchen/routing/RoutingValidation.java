package com.questrail.kitchen.routing;

import java.util.List;

/**
 * Result of checking a list of tag sets against a registry snapshot.
 *
 * @param unroutedIndexes indexes of the tag sets that no active station would receive
 * @param registryVersion snapshot version the check ran against
 */
public record RoutingValidation(List<Integer> unroutedIndexes, long registryVersion)
{
    public RoutingValidation {
        unroutedIndexes = List.copyOf(unroutedIndexes);
    }

    public boolean allRouted() {
        return unroutedIndexes.isEmpty();
    }
}
