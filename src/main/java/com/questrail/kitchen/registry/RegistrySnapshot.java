package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.RouteTag;
import com.questrail.kitchen.api.Station;
import com.questrail.kitchen.api.StationId;
import com.questrail.kitchen.api.StationKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * RegistrySnapshot
 * -----------------------------------------------------------------------------
 * Immutable, versioned view of the station registry.
 *
 * <p>A resolution captures one snapshot and uses it for its whole duration, so
 * a configuration change committed mid-flight can never produce a torn read.
 * Station order is configuration order and is the order of manifest entries.</p>
 */
public final class RegistrySnapshot
{
    private final long version;
    private final Map<StationId, Station> stations;

    RegistrySnapshot(long version, Map<StationId, Station> stations) {
        this.version = version;
        this.stations = Collections.unmodifiableMap(new LinkedHashMap<>(stations));
    }

    /**
     * Builds a standalone snapshot, mainly for tests and one-off validation.
     */
    public static RegistrySnapshot of(long version, List<Station> stations) {
        Map<StationId, Station> byId = new LinkedHashMap<>();
        for (Station s : stations) {
            if (byId.put(s.id(), s) != null) {
                throw new IllegalArgumentException("Duplicate station id: " + s.id());
            }
        }
        return new RegistrySnapshot(version, byId);
    }

    public long version() {
        return version;
    }

    public List<Station> stations() {
        return List.copyOf(stations.values());
    }

    public Optional<Station> station(StationId id) {
        return Optional.ofNullable(stations.get(id));
    }

    /**
     * Stations that can receive items: active with a non-empty tag set.
     */
    public List<Station> activeStations() {
        List<Station> active = new ArrayList<>();
        for (Station s : stations.values()) {
            if (s.routable()) {
                active.add(s);
            }
        }
        return active;
    }

    /**
     * Active stations whose subscription intersects {@code tags}, in registry order.
     */
    public Set<Station> stationsForTags(Set<RouteTag> tags) {
        Objects.requireNonNull(tags, "tags");
        Set<Station> out = new LinkedHashSet<>();
        if (tags.isEmpty()) {
            return out;
        }
        for (Station s : stations.values()) {
            if (!s.routable()) {
                continue;
            }
            for (RouteTag t : s.tags()) {
                if (tags.contains(t)) {
                    out.add(s);
                    break;
                }
            }
        }
        return out;
    }

    /**
     * Checks the snapshot for configuration problems.
     */
    public List<ConfigurationWarning> configurationWarnings(TagRegistry tagRegistry) {
        Objects.requireNonNull(tagRegistry, "tagRegistry");
        List<ConfigurationWarning> warnings = new ArrayList<>();

        if (activeStations().isEmpty()) {
            warnings.add(new ConfigurationWarning(ConfigurationWarning.Kind.NO_ACTIVE_STATIONS, null, null,
                    "No active station with tags is configured; every item will be unrouted"));
        }

        for (Station s : stations.values()) {
            if (s.active() && s.tags().isEmpty()) {
                warnings.add(new ConfigurationWarning(ConfigurationWarning.Kind.EMPTY_TAG_SET, s.id(), null,
                        "Station '" + s.name() + "' is active but subscribes to no tags"));
            }
            for (RouteTag unknown : tagRegistry.unknownTags(s.tags())) {
                warnings.add(new ConfigurationWarning(ConfigurationWarning.Kind.UNKNOWN_TAG, s.id(), unknown,
                        "Station '" + s.name() + "' subscribes to unknown tag '" + unknown + "'"));
            }
            s.backupStationId().ifPresent(backupId -> {
                Station backup = stations.get(backupId);
                if (backup == null) {
                    warnings.add(new ConfigurationWarning(ConfigurationWarning.Kind.MISSING_BACKUP_STATION, s.id(), null,
                            "Station '" + s.name() + "' names missing backup station " + backupId));
                }
                else if (backup.kind() != StationKind.PRINTER || s.kind() != StationKind.PRINTER) {
                    warnings.add(new ConfigurationWarning(ConfigurationWarning.Kind.BACKUP_NOT_PRINTER, s.id(), null,
                            "Backup " + backupId + " of station '" + s.name() + "' is ignored: failover is printer to printer only"));
                }
            });
        }
        return warnings;
    }

    @Override
    public String toString() {
        return "RegistrySnapshot[v" + version + " stations=" + stations.keySet() + "]";
    }
}
