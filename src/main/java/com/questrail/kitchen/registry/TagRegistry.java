package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.OrderItem;
import com.questrail.kitchen.api.RouteTag;
import com.questrail.kitchen.api.TagSource;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TagRegistry
 * -----------------------------------------------------------------------------
 * Closed set of known route tags, owned by menu configuration and read-only to
 * the router.
 *
 * <p>The registry also owns the effective tag rule: an item's own non-empty
 * tag set overrides its category's tags, and category tags are only a
 * fallback. The two sets are never merged.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class TagRegistry
{
    private final Map<RouteTag, RouteTagDefinition> definitions;

    private TagRegistry(Map<RouteTag, RouteTagDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    /**
     * The standard tag set of a restaurant installation.
     */
    public static TagRegistry defaults() {
        return builder()
                .define("kitchen", "General kitchen items")
                .define("bar", "Drinks prepared at the bar")
                .define("pizza", "Pizza oven")
                .define("grill", "Grill line")
                .define("fryer", "Fryer station")
                .define("salad", "Cold prep and salads")
                .define("expo", "Expediter, sees everything that leaves the kitchen")
                .define("entertainment", "Lanes, games and other non-food items")
                .define("made-to-order", "Items cooked on demand")
                .define("rush", "Priority items")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isKnown(RouteTag tag) {
        return definitions.containsKey(tag);
    }

    public Optional<RouteTagDefinition> definition(RouteTag tag) {
        return Optional.ofNullable(definitions.get(tag));
    }

    public Collection<RouteTagDefinition> definitions() {
        return definitions.values();
    }

    /**
     * Applies the item-over-category fallback rule.
     */
    public EffectiveTags effectiveTags(OrderItem item) {
        Objects.requireNonNull(item, "item");
        if (!item.ownTags().isEmpty()) {
            return new EffectiveTags(item.ownTags(), TagSource.ITEM);
        }
        if (!item.categoryTags().isEmpty()) {
            return new EffectiveTags(item.categoryTags(), TagSource.CATEGORY);
        }
        return EffectiveTags.NONE;
    }

    /**
     * Returns the tags of {@code tags} that this registry does not know, in order.
     */
    public Set<RouteTag> unknownTags(Collection<RouteTag> tags) {
        Set<RouteTag> unknown = new LinkedHashSet<>();
        for (RouteTag t : tags) {
            if (!isKnown(t)) {
                unknown.add(t);
            }
        }
        return unknown;
    }

    public static final class Builder {
        private final Map<RouteTag, RouteTagDefinition> definitions = new LinkedHashMap<>();

        public Builder define(String tag, String description) {
            return define(RouteTagDefinition.of(tag, description));
        }

        public Builder define(RouteTagDefinition definition) {
            Objects.requireNonNull(definition, "definition");
            definitions.put(definition.tag(), definition);
            return this;
        }

        public Builder from(TagRegistry registry) {
            definitions.putAll(registry.definitions);
            return this;
        }

        public TagRegistry build() {
            return new TagRegistry(definitions);
        }
    }
}
