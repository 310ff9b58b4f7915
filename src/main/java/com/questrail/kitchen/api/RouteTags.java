package com.questrail.kitchen.api;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Helpers for building immutable, insertion-ordered tag sets.
 */
public final class RouteTags
{
    private RouteTags() {}

    public static Set<RouteTag> of(String... raw) {
        Objects.requireNonNull(raw, "raw");
        return parse(Arrays.asList(raw));
    }

    public static Set<RouteTag> parse(Collection<String> raw) {
        Objects.requireNonNull(raw, "raw");
        Set<RouteTag> tags = new LinkedHashSet<>();
        for (String r : raw) {
            tags.add(RouteTag.of(r));
        }
        return Collections.unmodifiableSet(tags);
    }

    public static Set<RouteTag> copyOf(Collection<RouteTag> tags) {
        Objects.requireNonNull(tags, "tags");
        Set<RouteTag> copy = new LinkedHashSet<>();
        for (RouteTag t : tags) {
            copy.add(Objects.requireNonNull(t, "tag"));
        }
        return Collections.unmodifiableSet(copy);
    }

    /**
     * Returns the tags of {@code a} that also appear in {@code b}, in the order of {@code a}.
     */
    public static Set<RouteTag> intersection(Set<RouteTag> a, Set<RouteTag> b) {
        Set<RouteTag> out = new LinkedHashSet<>();
        for (RouteTag t : a) {
            if (b.contains(t)) {
                out.add(t);
            }
        }
        return out;
    }
}
