package com.questrail.kitchen.registry;

import com.questrail.kitchen.api.RouteTag;

import java.util.Objects;

/**
 * A known route tag and what it is for.
 */
public record RouteTagDefinition(RouteTag tag, String description)
{
    public RouteTagDefinition {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(description, "description");
    }

    public static RouteTagDefinition of(String tag, String description) {
        return new RouteTagDefinition(RouteTag.of(tag), description);
    }
}
