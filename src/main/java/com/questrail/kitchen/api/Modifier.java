package com.questrail.kitchen.api;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A modifier attached to an order item.
 *
 * <p>
 * {@code depth} is the nesting level: {@code 0} for a modifier chosen directly
 * on the item, {@code 1} for a modifier of that modifier, and so on.
 * {@code preModifier} is the optional instruction word in front of the name
 * ("No", "Extra", "Lite", "Side").
 * </p>
 */
public record Modifier(
        String name,
        String preModifier,
        int depth,
        int quantity
) {
    private static final Set<String> DESTRUCTIVE_WORDS = Set.of("no", "without", "hold", "remove");

    public Modifier {
        Objects.requireNonNull(name, "name");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0 (was " + depth + ")");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1 (was " + quantity + ")");
        }
    }

    public static Modifier of(String name) {
        return new Modifier(name, null, 0, 1);
    }

    public static Modifier of(String name, int depth) {
        return new Modifier(name, null, depth, 1);
    }

    public static Modifier withPre(String preModifier, String name, int depth) {
        return new Modifier(name, preModifier, depth, 1);
    }

    public Optional<String> pre() {
        return Optional.ofNullable(preModifier).filter(p -> !p.isBlank());
    }

    /**
     * True if this modifier removes something from the item ("No Pickles",
     * pre-modifier "no"). Destructive modifiers must stand out on every ticket.
     */
    public boolean destructive() {
        if (pre().map(p -> DESTRUCTIVE_WORDS.contains(p.trim().toLowerCase(Locale.ROOT))).orElse(false)) {
            return true;
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        for (String word : DESTRUCTIVE_WORDS) {
            if (lower.startsWith(word + " ")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Display text: pre-modifier and name, e.g. "No Pickles".
     */
    public String displayText() {
        return pre().map(p -> p + " " + name).orElse(name);
    }
}
