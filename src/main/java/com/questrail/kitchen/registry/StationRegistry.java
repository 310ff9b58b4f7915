package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.Station;
import com.questrail.kitchen.api.StationId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * StationRegistry
 * -----------------------------------------------------------------------------
 * Read-mostly registry of configured stations.
 *
 * <p>Every mutation is a copy-on-write of the whole station map and bumps the
 * version. Readers call {@link #snapshot()} once per resolution; the snapshot
 * they hold never changes underneath them. A mutation is visible to every
 * resolution that starts after it commits.</p>
 */
public final class StationRegistry
{
    private final AtomicReference<RegistrySnapshot> current;

    public StationRegistry() {
        this(List.of());
    }

    public StationRegistry(List<Station> initial) {
        this.current = new AtomicReference<>(RegistrySnapshot.of(1L, initial));
    }

    public RegistrySnapshot snapshot() {
        return current.get();
    }

    /**
     * Adds the station, or replaces the station with the same id in place.
     */
    public RegistrySnapshot upsert(Station station) {
        Objects.requireNonNull(station, "station");
        return mutate(map -> {
            map.put(station.id(), station);
            return map;
        });
    }

    /**
     * Removes a station. Removing an unknown id still bumps the version.
     */
    public RegistrySnapshot remove(StationId id) {
        Objects.requireNonNull(id, "id");
        return mutate(map -> {
            map.remove(id);
            return map;
        });
    }

    public RegistrySnapshot setActive(StationId id, boolean active) {
        Objects.requireNonNull(id, "id");
        return mutate(map -> {
            Station s = map.get(id);
            if (s == null) {
                throw new IllegalArgumentException("Unknown station: " + id);
            }
            map.put(id, s.withActive(active));
            return map;
        });
    }

    public RegistrySnapshot replaceAll(List<Station> stations) {
        Objects.requireNonNull(stations, "stations");
        RegistrySnapshot validated = RegistrySnapshot.of(0L, stations);
        return mutate(map -> {
            map.clear();
            for (Station s : validated.stations()) {
                map.put(s.id(), s);
            }
            return map;
        });
    }

    private RegistrySnapshot mutate(UnaryOperator<Map<StationId, Station>> change) {
        while (true) {
            RegistrySnapshot before = current.get();
            Map<StationId, Station> copy = new LinkedHashMap<>();
            for (Station s : before.stations()) {
                copy.put(s.id(), s);
            }
            RegistrySnapshot after = new RegistrySnapshot(before.version() + 1, change.apply(copy));
            if (current.compareAndSet(before, after)) {
                return after;
            }
        }
    }
}
