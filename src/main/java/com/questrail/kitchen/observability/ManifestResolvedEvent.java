package com.questrail.kitchen.observability;

import com.questrail.kitchen.api.RoutingManifest;

import java.time.Instant;

/**
 * A manifest was resolved for a send action.
 */
public record ManifestResolvedEvent(Instant timestamp, RoutingManifest manifest)
{
    public boolean hasUnrouted() {
        return !manifest.unrouted().isEmpty();
    }
}
