package com.questrail.kitchen.print.codec.impl;

import com.questrail.kitchen.print.codec.PrinterCommandEncoder;
import com.questrail.kitchen.print.model.Alignment;
import com.questrail.kitchen.print.model.PrintInstruction;
import com.questrail.kitchen.print.model.PrintTicket;
import com.questrail.kitchen.print.model.TextStyle;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Shared ESC/POS encoding. Subclasses only differ in how character attributes
 * are switched.
 *
 * <p>The encoder tracks the printer's current style and only emits a command
 * when an attribute changes. The tracked style starts as
 * {@link TextStyle#PLAIN} and returns to it on every {@code Initialize}.</p>
 */
abstract class AbstractEscPosEncoder implements PrinterCommandEncoder
{
    @Override
    public final byte[] encode(PrintTicket ticket) {
        Objects.requireNonNull(ticket, "ticket");

        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        TextStyle current = TextStyle.PLAIN;

        for (PrintInstruction instruction : ticket.instructions()) {
            if (instruction instanceof PrintInstruction.Initialize) {
                write(out, EscPosCommands.ESC, EscPosCommands.INIT);
                current = TextStyle.PLAIN;
            }
            else if (instruction instanceof PrintInstruction.TextLine line) {
                checkSupported(line.style());
                if (line.style().alignment() != current.alignment()) {
                    write(out, EscPosCommands.ESC, EscPosCommands.ALIGN, alignmentCode(line.style().alignment()));
                }
                switchAttributes(out, current, line.style());
                current = line.style();
                writeText(out, line.text());
                out.write(EscPosCommands.LF);
            }
            else if (instruction instanceof PrintInstruction.Feed feed) {
                write(out, EscPosCommands.ESC, EscPosCommands.FEED, feed.lines());
            }
            else if (instruction instanceof PrintInstruction.Cut cut) {
                write(out, EscPosCommands.GS, EscPosCommands.CUT,
                        cut.partial() ? EscPosCommands.CUT_PARTIAL_FEED : EscPosCommands.CUT_FULL_FEED, 0);
            }
            else if (instruction instanceof PrintInstruction.Buzzer buzzer) {
                write(out, EscPosCommands.ESC, EscPosCommands.BUZZER, buzzer.times(), buzzer.pulseUnits());
            }
        }
        return out.toByteArray();
    }

    /**
     * Rejects attributes this dialect cannot print.
     */
    protected abstract void checkSupported(TextStyle style);

    /**
     * Emits the commands that take the printer from {@code from} to {@code to}.
     * Alignment is handled by the caller.
     */
    protected abstract void switchAttributes(ByteArrayOutputStream out, TextStyle from, TextStyle to);

    protected static void write(ByteArrayOutputStream out, int... bytes) {
        for (int b : bytes) {
            out.write(b & 0xFF);
        }
    }

    static int alignmentCode(Alignment alignment) {
        return switch (alignment) {
            case LEFT -> 0;
            case CENTER -> 1;
            case RIGHT -> 2;
        };
    }

    private static void writeText(ByteArrayOutputStream out, String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            out.write(c >= 0x20 && c <= 0x7E ? c : EscPosCommands.REPLACEMENT);
        }
    }
}
