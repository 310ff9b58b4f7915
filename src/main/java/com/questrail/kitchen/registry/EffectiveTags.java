package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.RouteTag;
import com.questrail.kitchen.api.RouteTags;
import com.questrail.kitchen.api.TagSource;

import java.util.Objects;
import java.util.Set;

/**
 * The tag set used for routing an item, and where it came from.
 */
public record EffectiveTags(Set<RouteTag> tags, TagSource source)
{
    public static final EffectiveTags NONE = new EffectiveTags(Set.of(), TagSource.NONE);

    public EffectiveTags {
        tags = RouteTags.copyOf(tags);
        Objects.requireNonNull(source, "source");
        if (tags.isEmpty() != (source == TagSource.NONE)) {
            throw new IllegalArgumentException("source " + source + " does not match tag set " + tags);
        }
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }
}
