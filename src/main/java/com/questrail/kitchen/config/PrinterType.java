package com.questrail.kitchen.config;

/**
 * Printer family, which decides the ESC/POS dialect and how emphasis is drawn.
 */
public enum PrinterType
{
    /** Monochrome thermal receipt printer: GS ! sizing, GS B inverse. */
    THERMAL,
    /** Two-colour impact (dot matrix) kitchen printer: ESC ! sizing, red ribbon. */
    IMPACT
}
