package com.questrail.kitchen.channel;

import com.questrail.kitchen.api.OrderContext;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.api.StationId;

import java.time.Instant;
import java.util.Objects;

/**
 * What a kitchen display receives for one send action: the order header and
 * the station's manifest entry.
 *
 * <p>{@code sequence} increases per hub across all stations, so a client can
 * spot reordering or gaps in its own stream.</p>
 */
public record StationMessage(long sequence, OrderContext order, RoutingManifestEntry entry, Instant publishedAt)
{
    public StationMessage {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(publishedAt, "publishedAt");
    }

    public StationId stationId() {
        return entry.stationId();
    }
}
