package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.RouteTags;
import com.questrail.kitchen.api.Station;
import com.questrail.kitchen.api.StationId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StationRegistryTest {

    private static Station grill() {
        return Station.display("grill", "Grill KDS").tags("grill").build();
    }

    private static Station bar() {
        return Station.printer("bar", "Bar Printer").tags("bar").build();
    }

    @Test
    void registryStartsAtVersionOne() {
        StationRegistry registry = new StationRegistry(List.of(grill()));
        assertEquals(1, registry.snapshot().version());
    }

    @Test
    void everyMutationBumpsTheVersion() {
        StationRegistry registry = new StationRegistry(List.of(grill()));

        assertEquals(2, registry.upsert(bar()).version());
        assertEquals(3, registry.setActive(StationId.of("bar"), false).version());
        assertEquals(4, registry.remove(StationId.of("bar")).version());
        assertEquals(5, registry.replaceAll(List.of(bar())).version());
    }

    @Test
    void snapshotsAreNotAffectedByLaterMutations() {
        StationRegistry registry = new StationRegistry(List.of(grill()));
        RegistrySnapshot before = registry.snapshot();

        registry.setActive(StationId.of("grill"), false);

        assertTrue(before.station(StationId.of("grill")).orElseThrow().active());
        assertFalse(registry.snapshot().station(StationId.of("grill")).orElseThrow().active());
    }

    @Test
    void upsertReplacesInPlaceAndKeepsOrder() {
        StationRegistry registry = new StationRegistry(List.of(grill(), bar()));

        registry.upsert(grill().toBuilder().name("Grill Line").build());

        List<Station> stations = registry.snapshot().stations();
        assertEquals("Grill Line", stations.get(0).name());
        assertEquals(StationId.of("bar"), stations.get(1).id());
    }

    @Test
    void settingActiveOnUnknownStationFails() {
        StationRegistry registry = new StationRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.setActive(StationId.of("nope"), true));
        assertEquals(1, registry.snapshot().version());
    }

    @Test
    void duplicateStationIdsAreRejected() {
        StationRegistry registry = new StationRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.replaceAll(List.of(grill(), grill())));
    }

    @Test
    void inactiveAndUntaggedStationsAreNotRoutable() {
        Station idle = Station.display("idle", "Idle").build();
        Station off = Station.display("off", "Off").tags("grill").active(false).build();
        RegistrySnapshot snapshot = RegistrySnapshot.of(1, List.of(grill(), idle, off));

        assertEquals(List.of(grill()), snapshot.activeStations());
        assertEquals(1, snapshot.stationsForTags(RouteTags.of("grill")).size());
    }

    @Test
    void configurationProblemsAreWarnings() {
        Station idle = Station.display("idle", "Idle").build();
        Station sushi = Station.display("sushi", "Sushi").tags("sushi").build();
        Station lonely = Station.printer("p1", "Printer 1").tags("kitchen").backup("p9").build();
        RegistrySnapshot snapshot = RegistrySnapshot.of(7, List.of(idle, sushi, lonely));

        List<ConfigurationWarning> warnings = snapshot.configurationWarnings(TagRegistry.defaults());

        assertEquals(List.of(
                ConfigurationWarning.Kind.EMPTY_TAG_SET,
                ConfigurationWarning.Kind.UNKNOWN_TAG,
                ConfigurationWarning.Kind.MISSING_BACKUP_STATION),
                warnings.stream().map(ConfigurationWarning::kind).toList());
    }

    @Test
    void emptyRegistryWarnsThatNothingIsRoutable() {
        List<ConfigurationWarning> warnings = new StationRegistry().snapshot()
                .configurationWarnings(TagRegistry.defaults());

        assertEquals(1, warnings.size());
        assertEquals(ConfigurationWarning.Kind.NO_ACTIVE_STATIONS, warnings.get(0).kind());
    }
}
