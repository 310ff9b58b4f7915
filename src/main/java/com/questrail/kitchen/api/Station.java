package com.questrail.kitchen.api;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A configured delivery destination.
 *
 * <p>
 * Stations are created and edited by external configuration and are read-only
 * to the routing engine. A station only ever receives items when it is active
 * <em>and</em> subscribes to at least one tag.
 * </p>
 *
 * <p>
 * {@code showReferenceItems} asks the resolver to attach the other items of the
 * same send event to this station's entry, so a line cook can see that the
 * burger belongs to an order that also has a pizza. {@code backupStationId}
 * names a printer that takes over a ticket when this printer exhausts its
 * retry budget.
 * </p>
 */
public final class Station
{
    private final StationId id;
    private final String name;
    private final StationKind kind;
    private final Set<RouteTag> tags;
    private final boolean active;
    private final boolean showReferenceItems;
    private final StationId backupStationId;

    private Station(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.name = Objects.requireNonNull(b.name, "name");
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.tags = RouteTags.copyOf(b.tags);
        this.active = b.active;
        this.showReferenceItems = b.showReferenceItems;
        this.backupStationId = b.backupStationId;

        if (id.equals(backupStationId)) {
            throw new IllegalArgumentException("Station " + id + " cannot be its own backup");
        }
    }

    public StationId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public StationKind kind() {
        return kind;
    }

    /**
     * Subscribed tags, in configuration order.
     */
    public Set<RouteTag> tags() {
        return tags;
    }

    public boolean active() {
        return active;
    }

    public boolean showReferenceItems() {
        return showReferenceItems;
    }

    public Optional<StationId> backupStationId() {
        return Optional.ofNullable(backupStationId);
    }

    /**
     * True if this station can receive items at all: active and subscribed to
     * at least one tag.
     */
    public boolean routable() {
        return active && !tags.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .kind(kind)
                .tags(tags)
                .active(active)
                .showReferenceItems(showReferenceItems)
                .backupStationId(backupStationId);
    }

    public Station withActive(boolean active) {
        return toBuilder().active(active).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder display(String id, String name) {
        return new Builder().id(StationId.of(id)).name(name).kind(StationKind.DISPLAY);
    }

    public static Builder printer(String id, String name) {
        return new Builder().id(StationId.of(id)).name(name).kind(StationKind.PRINTER);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Station that)) return false;
        return active == that.active
                && showReferenceItems == that.showReferenceItems
                && id.equals(that.id)
                && name.equals(that.name)
                && kind == that.kind
                && tags.equals(that.tags)
                && Objects.equals(backupStationId, that.backupStationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, kind, tags, active, showReferenceItems, backupStationId);
    }

    @Override
    public String toString() {
        return "Station[" + id + " '" + name + "' " + kind + " tags=" + tags + (active ? "" : " inactive") + "]";
    }

    public static final class Builder {
        private StationId id;
        private String name;
        private StationKind kind;
        private Set<RouteTag> tags = Set.of();
        private boolean active = true;
        private boolean showReferenceItems = false;
        private StationId backupStationId;

        public Builder id(StationId id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(StationKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder tags(Set<RouteTag> tags) {
            this.tags = Objects.requireNonNull(tags, "tags");
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = RouteTags.of(tags);
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder showReferenceItems(boolean show) {
            this.showReferenceItems = show;
            return this;
        }

        public Builder backupStationId(StationId backup) {
            this.backupStationId = backup;
            return this;
        }

        public Builder backup(String backupId) {
            this.backupStationId = backupId == null ? null : StationId.of(backupId);
            return this;
        }

        public Station build() {
            return new Station(this);
        }
    }
}
