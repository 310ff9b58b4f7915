package com.questrail.kitchen.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Read-only snapshot of one order item at the moment of a send action.
 *
 * <p>
 * The item carries both its own route tags and the tags of its category. The
 * resolver decides which of the two sets is effective; this type only holds
 * the data. Items are shared by reference between every manifest entry they
 * are routed to, so the snapshot is deeply immutable.
 * </p>
 *
 * <p>
 * {@code sent} is owned by the order subsystem: items already dispatched by an
 * earlier send action are marked and skipped by the resolver.
 * </p>
 */
public final class OrderItem
{
    private final String id;
    private final String name;
    private final int quantity;
    private final Set<RouteTag> ownTags;
    private final String categoryName;
    private final Set<RouteTag> categoryTags;
    private final List<Modifier> modifiers;
    private final List<IngredientModification> ingredientModifications;
    private final String specialNotes;
    private final Integer seatNumber;
    private final Integer courseNumber;
    private final String sourceTable;
    private final int resendCount;
    private final boolean sent;

    private OrderItem(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.name = Objects.requireNonNull(b.name, "name");
        if (b.quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1 (item " + b.id + ")");
        }
        if (b.resendCount < 0) {
            throw new IllegalArgumentException("resendCount must be >= 0 (item " + b.id + ")");
        }
        this.quantity = b.quantity;
        this.ownTags = RouteTags.copyOf(b.ownTags);
        this.categoryName = b.categoryName;
        this.categoryTags = RouteTags.copyOf(b.categoryTags);
        this.modifiers = List.copyOf(b.modifiers);
        this.ingredientModifications = List.copyOf(b.ingredientModifications);
        this.specialNotes = b.specialNotes;
        this.seatNumber = b.seatNumber;
        this.courseNumber = b.courseNumber;
        this.sourceTable = b.sourceTable;
        this.resendCount = b.resendCount;
        this.sent = b.sent;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public int quantity() {
        return quantity;
    }

    public Set<RouteTag> ownTags() {
        return ownTags;
    }

    public Optional<String> categoryName() {
        return Optional.ofNullable(categoryName);
    }

    public Set<RouteTag> categoryTags() {
        return categoryTags;
    }

    public List<Modifier> modifiers() {
        return modifiers;
    }

    public List<IngredientModification> ingredientModifications() {
        return ingredientModifications;
    }

    public Optional<String> specialNotes() {
        return Optional.ofNullable(specialNotes).filter(n -> !n.isBlank());
    }

    public OptionalInt seatNumber() {
        return seatNumber == null ? OptionalInt.empty() : OptionalInt.of(seatNumber);
    }

    public OptionalInt courseNumber() {
        return courseNumber == null ? OptionalInt.empty() : OptionalInt.of(courseNumber);
    }

    /**
     * Abbreviation of the table the item was ordered from, for combined tables.
     */
    public Optional<String> sourceTable() {
        return Optional.ofNullable(sourceTable);
    }

    public int resendCount() {
        return resendCount;
    }

    public boolean sent() {
        return sent;
    }

    public boolean hasDestructiveModifier() {
        for (Modifier m : modifiers) {
            if (m.destructive()) return true;
        }
        for (IngredientModification i : ingredientModifications) {
            if (i.destructive()) return true;
        }
        return false;
    }

    public static Builder builder(String id, String name) {
        return new Builder().id(id).name(name);
    }

    @Override
    public String toString() {
        return "OrderItem[" + id + " " + quantity + "x " + name + "]";
    }

    public static final class Builder {
        private String id;
        private String name;
        private int quantity = 1;
        private Set<RouteTag> ownTags = Set.of();
        private String categoryName;
        private Set<RouteTag> categoryTags = Set.of();
        private final List<Modifier> modifiers = new ArrayList<>();
        private final List<IngredientModification> ingredientModifications = new ArrayList<>();
        private String specialNotes;
        private Integer seatNumber;
        private Integer courseNumber;
        private String sourceTable;
        private int resendCount;
        private boolean sent;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder quantity(int quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder tags(String... tags) {
            this.ownTags = RouteTags.of(tags);
            return this;
        }

        public Builder tags(Set<RouteTag> tags) {
            this.ownTags = Objects.requireNonNull(tags, "tags");
            return this;
        }

        public Builder category(String categoryName, String... categoryTags) {
            this.categoryName = categoryName;
            this.categoryTags = RouteTags.of(categoryTags);
            return this;
        }

        public Builder category(String categoryName, Set<RouteTag> categoryTags) {
            this.categoryName = categoryName;
            this.categoryTags = Objects.requireNonNull(categoryTags, "categoryTags");
            return this;
        }

        public Builder modifier(Modifier modifier) {
            this.modifiers.add(Objects.requireNonNull(modifier, "modifier"));
            return this;
        }

        public Builder modifiers(List<Modifier> modifiers) {
            this.modifiers.clear();
            this.modifiers.addAll(modifiers);
            return this;
        }

        public Builder ingredientModification(IngredientModification mod) {
            this.ingredientModifications.add(Objects.requireNonNull(mod, "mod"));
            return this;
        }

        public Builder specialNotes(String notes) {
            this.specialNotes = notes;
            return this;
        }

        public Builder seat(Integer seat) {
            this.seatNumber = seat;
            return this;
        }

        public Builder course(Integer course) {
            this.courseNumber = course;
            return this;
        }

        public Builder sourceTable(String abbreviation) {
            this.sourceTable = abbreviation;
            return this;
        }

        public Builder resendCount(int resendCount) {
            this.resendCount = resendCount;
            return this;
        }

        public Builder sent(boolean sent) {
            this.sent = sent;
            return this;
        }

        public OrderItem build() {
            return new OrderItem(this);
        }
    }
}
