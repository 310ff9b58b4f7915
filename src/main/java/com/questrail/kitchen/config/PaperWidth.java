package com.questrail.kitchen.config;

/**
 * Paper roll width and the number of normal-size characters per line.
 */
public enum PaperWidth
{
    MM_80(48),
    MM_58(32),
    MM_40(24);

    private final int columns;

    PaperWidth(int columns) {
        this.columns = columns;
    }

    public int columns() {
        return columns;
    }
}
