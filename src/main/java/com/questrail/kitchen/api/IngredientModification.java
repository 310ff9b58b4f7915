package com.questrail.kitchen.api;

import java.util.Objects;
import java.util.Optional;

/**
 * A change to one of an item's recipe ingredients ("NO onion", "SWAP fries -> salad").
 */
public record IngredientModification(
        String ingredientName,
        Type type,
        String swappedTo
) {
    public enum Type {
        NO,
        LITE,
        EXTRA,
        ON_SIDE,
        SWAP
    }

    public IngredientModification {
        Objects.requireNonNull(ingredientName, "ingredientName");
        Objects.requireNonNull(type, "type");
        if (type == Type.SWAP && (swappedTo == null || swappedTo.isBlank())) {
            throw new IllegalArgumentException("SWAP modification requires a replacement ingredient");
        }
    }

    public static IngredientModification of(Type type, String ingredientName) {
        return new IngredientModification(ingredientName, type, null);
    }

    public Optional<String> replacement() {
        return Optional.ofNullable(swappedTo);
    }

    public boolean destructive() {
        return type == Type.NO;
    }

    public String displayText() {
        return switch (type) {
            case NO -> "NO " + ingredientName;
            case LITE -> "LITE " + ingredientName;
            case EXTRA -> "EXTRA " + ingredientName;
            case ON_SIDE -> ingredientName + " ON SIDE";
            case SWAP -> "SWAP " + ingredientName + " -> " + swappedTo;
        };
    }
}
