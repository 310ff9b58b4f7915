package com.questrail.kitchen.print.codec.impl;

import com.questrail.kitchen.print.model.TextSize;
import com.questrail.kitchen.print.model.TextStyle;

import java.io.ByteArrayOutputStream;

/**
 * EscPosThermalEncoder
 * -----------------------------------------------------------------------------
 * ESC/POS dialect for monochrome thermal printers.
 *
 * <ul>
 *   <li>bold: {@code ESC E n}</li>
 *   <li>size: {@code GS ! n}, width multiplier in the high nibble, height in the low</li>
 *   <li>inverse: {@code GS B n}</li>
 * </ul>
 *
 * Red text cannot be printed and is rejected.
 */
public final class EscPosThermalEncoder extends AbstractEscPosEncoder
{
    @Override
    protected void checkSupported(TextStyle style) {
        if (style.red()) {
            throw new UnsupportedPrinterCommandException("Thermal printers cannot print red text");
        }
    }

    @Override
    protected void switchAttributes(ByteArrayOutputStream out, TextStyle from, TextStyle to) {
        if (from.bold() != to.bold()) {
            write(out, EscPosCommands.ESC, EscPosCommands.BOLD, to.bold() ? 1 : 0);
        }
        if (from.size() != to.size()) {
            write(out, EscPosCommands.GS, EscPosCommands.CHAR_SIZE, sizeCode(to.size()));
        }
        if (from.inverse() != to.inverse()) {
            write(out, EscPosCommands.GS, EscPosCommands.INVERSE, to.inverse() ? 1 : 0);
        }
    }

    static int sizeCode(TextSize size) {
        return (size.doubleWidth() ? 0x10 : 0) | (size.doubleHeight() ? 0x01 : 0);
    }
}
