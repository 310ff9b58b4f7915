package com.questrail.kitchen.print.model;

import java.util.Objects;

/**
 * Character attributes of one printed line.
 *
 * <p>{@code inverse} (white on black) only exists on thermal printers and
 * {@code red} only on two-colour impact printers. Encoders reject the
 * attribute their protocol cannot express.</p>
 */
public record TextStyle(boolean bold, TextSize size, Alignment alignment, boolean inverse, boolean red)
{
    public static final TextStyle PLAIN = new TextStyle(false, TextSize.NORMAL, Alignment.LEFT, false, false);

    public TextStyle {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(alignment, "alignment");
    }

    public TextStyle withBold(boolean bold) {
        return new TextStyle(bold, size, alignment, inverse, red);
    }

    public TextStyle withSize(TextSize size) {
        return new TextStyle(bold, size, alignment, inverse, red);
    }

    public TextStyle withAlignment(Alignment alignment) {
        return new TextStyle(bold, size, alignment, inverse, red);
    }

    public TextStyle withInverse(boolean inverse) {
        return new TextStyle(bold, size, alignment, inverse, red);
    }

    public TextStyle withRed(boolean red) {
        return new TextStyle(bold, size, alignment, inverse, red);
    }
}
