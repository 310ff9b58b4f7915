package com.questrail.kitchen.print;

/**
 * How the quantity is written in front of an item name.
 */
public enum QuantityFormat
{
    /** {@code 2x Burger} */
    NUMBER_X,
    /** {@code x2 Burger} */
    X_NUMBER,
    /** {@code 2 Burger} */
    NUMBER,
    /** {@code 2x} only when the quantity is above one */
    NUMBER_X_IF_MANY;

    public String format(int quantity) {
        return switch (this) {
            case NUMBER_X -> quantity + "x ";
            case X_NUMBER -> "x" + quantity + " ";
            case NUMBER -> quantity + " ";
            case NUMBER_X_IF_MANY -> quantity > 1 ? quantity + "x " : "";
        };
    }
}
