package com.questrail.kitchen.api;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Strongly typed route tag.
 *
 * <h2>What a RouteTag IS</h2>
 * <ul>
 *   <li>A label published by menu items and categories ("grill", "bar", ...)</li>
 *   <li>A label subscribed to by stations</li>
 *   <li>The only unit of matching used by the routing resolver</li>
 * </ul>
 *
 * <h2>What a RouteTag IS NOT</h2>
 * <ul>
 *   <li>It is <b>not</b> a printer or station identifier</li>
 *   <li>It does <b>not</b> carry any priority or ordering meaning</li>
 * </ul>
 *
 * <p>
 * Raw strings are normalised (trimmed, lower-cased) before validation so that
 * "Grill " and "grill" are the same tag. Whether a tag is <em>known</em> is a
 * question for the {@code TagRegistry}; this type only guarantees that the
 * value is well formed.
 * </p>
 */
public final class RouteTag implements Comparable<RouteTag>
{
    /**
     * Maximum length of a tag value.
     */
    public static final int MAX_LENGTH = 32;

    private static final Pattern VALID = Pattern.compile("[a-z0-9][a-z0-9_-]*");

    private final String value;

    private RouteTag(String value) {
        this.value = value;
    }

    /**
     * Creates a tag from a raw string.
     *
     * @param raw the raw tag text
     * @return the normalised tag
     * @throws IllegalArgumentException if the normalised value is empty, too long,
     *         or contains characters outside {@code [a-z0-9_-]}
     */
    public static RouteTag of(String raw) {
        Objects.requireNonNull(raw, "raw");
        String normalised = raw.trim().toLowerCase(Locale.ROOT);
        if (normalised.isEmpty()) {
            throw new IllegalArgumentException("Route tag must not be blank");
        }
        if (normalised.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "Route tag must be at most " + MAX_LENGTH + " characters (was " + normalised.length() + ")");
        }
        if (!VALID.matcher(normalised).matches()) {
            throw new IllegalArgumentException("Route tag contains invalid characters: '" + raw + "'");
        }
        return new RouteTag(normalised);
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(RouteTag o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RouteTag that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
