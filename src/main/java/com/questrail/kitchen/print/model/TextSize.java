package com.questrail.kitchen.print.model;

/**
 * Character magnification supported by both ESC/POS printer families.
 */
public enum TextSize
{
    NORMAL(false, false),
    DOUBLE_HEIGHT(true, false),
    DOUBLE_WIDTH(false, true),
    DOUBLE_SIZE(true, true);

    private final boolean doubleHeight;
    private final boolean doubleWidth;

    TextSize(boolean doubleHeight, boolean doubleWidth) {
        this.doubleHeight = doubleHeight;
        this.doubleWidth = doubleWidth;
    }

    public boolean doubleHeight() {
        return doubleHeight;
    }

    public boolean doubleWidth() {
        return doubleWidth;
    }

    public static TextSize of(boolean doubleHeight, boolean doubleWidth) {
        if (doubleHeight && doubleWidth) return DOUBLE_SIZE;
        if (doubleHeight) return DOUBLE_HEIGHT;
        if (doubleWidth) return DOUBLE_WIDTH;
        return NORMAL;
    }
}
