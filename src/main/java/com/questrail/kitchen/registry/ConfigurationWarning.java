package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.RouteTag;
import com.questrail.kitchen.api.StationId;

import java.util.Objects;
import java.util.Optional;

/**
 * A configuration problem found in a registry snapshot.
 *
 * <p>Warnings never stop resolution. With no active stations the system
 * degrades to "everything unrouted" instead of refusing to resolve.</p>
 */
public record ConfigurationWarning(Kind kind, StationId stationId, RouteTag tag, String message)
{
    public enum Kind {
        NO_ACTIVE_STATIONS,
        EMPTY_TAG_SET,
        UNKNOWN_TAG,
        MISSING_BACKUP_STATION,
        BACKUP_NOT_PRINTER
    }

    public ConfigurationWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public Optional<StationId> station() {
        return Optional.ofNullable(stationId);
    }

    public Optional<RouteTag> routeTag() {
        return Optional.ofNullable(tag);
    }
}
