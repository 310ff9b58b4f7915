package com.questrail.kitchen.print;

/**
 * Character used for horizontal rules on a ticket.
 */
public enum DividerStyle
{
    DASH('-'),
    DOUBLE('='),
    STAR('*'),
    DOT('.'),
    BLANK(' ');

    private final char ch;

    DividerStyle(char ch) {
        this.ch = ch;
    }

    public String line(int width) {
        if (this == BLANK) {
            return "";
        }
        return String.valueOf(ch).repeat(width);
    }
}
