package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.OrderItem;
import com.questrail.kitchen.api.RouteTag;
import com.questrail.kitchen.api.RouteTags;
import com.questrail.kitchen.api.TagSource;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagRegistryTest {

    private final TagRegistry registry = TagRegistry.defaults();

    @Test
    void defaultsCarryTheStandardTags() {
        for (String t : new String[] {"kitchen", "bar", "pizza", "grill", "fryer", "salad",
                "expo", "entertainment", "made-to-order", "rush"}) {
            assertTrue(registry.isKnown(RouteTag.of(t)), t);
        }
        assertFalse(registry.isKnown(RouteTag.of("sushi")));
    }

    @Test
    void itemTagsOverrideCategoryTags() {
        OrderItem item = OrderItem.builder("i1", "Fries")
                .tags("fryer")
                .category("Food", "kitchen")
                .build();

        EffectiveTags effective = registry.effectiveTags(item);

        assertEquals(RouteTags.of("fryer"), effective.tags());
        assertEquals(TagSource.ITEM, effective.source());
    }

    @Test
    void categoryTagsAreTheFallback() {
        OrderItem item = OrderItem.builder("i1", "Side Salad")
                .category("Salads", "salad")
                .build();

        EffectiveTags effective = registry.effectiveTags(item);

        assertEquals(RouteTags.of("salad"), effective.tags());
        assertEquals(TagSource.CATEGORY, effective.source());
    }

    @Test
    void itemWithoutAnyTagsHasNoEffectiveTags() {
        EffectiveTags effective = registry.effectiveTags(OrderItem.builder("i1", "Mystery").build());

        assertTrue(effective.isEmpty());
        assertEquals(TagSource.NONE, effective.source());
    }

    @Test
    void unknownTagsAreReportedInOrder() {
        Set<RouteTag> unknown = registry.unknownTags(RouteTags.of("sushi", "grill", "wok"));
        assertEquals(RouteTags.of("sushi", "wok"), unknown);
    }

    @Test
    void builderExtendsAnExistingRegistry() {
        TagRegistry extended = TagRegistry.builder()
                .from(registry)
                .define("sushi", "Sushi bar")
                .build();

        assertTrue(extended.isKnown(RouteTag.of("sushi")));
        assertTrue(extended.isKnown(RouteTag.of("grill")));
        assertEquals("Sushi bar", extended.definition(RouteTag.of("sushi")).orElseThrow().description());
        assertFalse(registry.isKnown(RouteTag.of("sushi")));
    }
}
