package com.questrail.kitchen.print.codec.impl;

import com.questrail.kitchen.config.PrinterType;
import com.questrail.kitchen.print.codec.PrinterCommandEncoder;

import java.util.Objects;

/**
 * Encoder lookup by printer family.
 */
public final class PrinterEncoders
{
    private static final PrinterCommandEncoder THERMAL = new EscPosThermalEncoder();
    private static final PrinterCommandEncoder IMPACT = new EscPosImpactEncoder();

    private PrinterEncoders() {}

    public static PrinterCommandEncoder forType(PrinterType type) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case THERMAL -> THERMAL;
            case IMPACT -> IMPACT;
        };
    }
}
