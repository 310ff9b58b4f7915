package com.questrail.kitchen.api;

import java.util.Objects;

/**
 * A tag seen on an item during resolution that the tag registry does not know.
 *
 * <p>The tag still takes part in matching; the diagnostic only makes sure a
 * typo such as "gril" leaves a trace instead of matching nothing silently.</p>
 */
public record TagDiagnostic(String itemId, String itemName, RouteTag tag, TagSource source)
{
    public TagDiagnostic {
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(itemName, "itemName");
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(source, "source");
    }
}
