package com.questrail.kitchen.print.codec.impl;

import com.questrail.kitchen.print.model.TextStyle;

import java.io.ByteArrayOutputStream;

/**
 * EscPosImpactEncoder
 * -----------------------------------------------------------------------------
 * ESC/POS dialect for two-colour impact kitchen printers.
 *
 * <p>Bold and size share one print mode byte ({@code ESC ! n}). Red ribbon is
 * selected with {@code ESC 4} and black with {@code ESC 5}. Impact printers
 * have no inverse mode, so inverse text is rejected.</p>
 */
public final class EscPosImpactEncoder extends AbstractEscPosEncoder
{
    @Override
    protected void checkSupported(TextStyle style) {
        if (style.inverse()) {
            throw new UnsupportedPrinterCommandException("Impact printers cannot print inverse text");
        }
    }

    @Override
    protected void switchAttributes(ByteArrayOutputStream out, TextStyle from, TextStyle to) {
        if (from.bold() != to.bold() || from.size() != to.size()) {
            write(out, EscPosCommands.ESC, EscPosCommands.PRINT_MODE, printMode(to));
        }
        if (from.red() != to.red()) {
            write(out, EscPosCommands.ESC, to.red() ? EscPosCommands.RED : EscPosCommands.BLACK);
        }
    }

    static int printMode(TextStyle style) {
        int mode = 0;
        if (style.bold()) mode |= EscPosCommands.MODE_EMPHASIZED;
        if (style.size().doubleHeight()) mode |= EscPosCommands.MODE_DOUBLE_HEIGHT;
        if (style.size().doubleWidth()) mode |= EscPosCommands.MODE_DOUBLE_WIDTH;
        return mode;
    }
}
