package com.questrail.kitchen.print.codec.impl;

import com.questrail.kitchen.print.codec.PrinterCommandDecoder;
import com.questrail.kitchen.print.model.Alignment;
import com.questrail.kitchen.print.model.PrintInstruction;
import com.questrail.kitchen.print.model.PrintTicket;
import com.questrail.kitchen.print.model.TextSize;
import com.questrail.kitchen.print.model.TextStyle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * EscPosDecoder
 * -----------------------------------------------------------------------------
 * Reads a payload produced by either ESC/POS encoder back into instructions.
 *
 * <p>The decoder replays the byte stream against a model of the printer's
 * current style. Text accumulates until a line feed, which yields one
 * {@link PrintInstruction.TextLine} carrying the style in effect at that
 * moment.</p>
 *
 * <p>Decoding an encoded ticket yields the original instructions, provided its
 * text is printable ASCII.</p>
 */
public final class EscPosDecoder implements PrinterCommandDecoder
{
    @Override
    public PrintTicket decode(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new Reader(payload).read();
    }

    private static final class Reader
    {
        private final byte[] in;
        private int pos;

        private final List<PrintInstruction> out = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private boolean bold;
        private TextSize size = TextSize.NORMAL;
        private Alignment alignment = Alignment.LEFT;
        private boolean inverse;
        private boolean red;

        Reader(byte[] in) {
            this.in = in;
        }

        PrintTicket read() {
            while (pos < in.length) {
                int b = next();
                if (b == EscPosCommands.ESC) {
                    esc();
                }
                else if (b == EscPosCommands.GS) {
                    gs();
                }
                else if (b == EscPosCommands.LF) {
                    out.add(new PrintInstruction.TextLine(text.toString(),
                            new TextStyle(bold, size, alignment, inverse, red)));
                    text.setLength(0);
                }
                else if (b >= 0x20 && b <= 0x7E) {
                    text.append((char) b);
                }
                else {
                    throw new PrinterCommandDecodeException(
                            String.format("Unexpected control byte 0x%02X at offset %d", b, pos - 1));
                }
            }
            if (text.length() > 0) {
                throw new PrinterCommandDecodeException("Text without terminating line feed: '" + text + "'");
            }
            return new PrintTicket(out);
        }

        private void esc() {
            int cmd = next();
            switch (cmd) {
                case EscPosCommands.INIT -> {
                    requireNoPendingText("ESC @");
                    bold = false;
                    size = TextSize.NORMAL;
                    alignment = Alignment.LEFT;
                    inverse = false;
                    red = false;
                    out.add(new PrintInstruction.Initialize());
                }
                case EscPosCommands.BOLD -> bold = (next() & 0x01) != 0;
                case EscPosCommands.PRINT_MODE -> {
                    int mode = next();
                    bold = (mode & EscPosCommands.MODE_EMPHASIZED) != 0;
                    size = TextSize.of(
                            (mode & EscPosCommands.MODE_DOUBLE_HEIGHT) != 0,
                            (mode & EscPosCommands.MODE_DOUBLE_WIDTH) != 0);
                }
                case EscPosCommands.ALIGN -> alignment = alignment(next());
                case EscPosCommands.RED -> red = true;
                case EscPosCommands.BLACK -> red = false;
                case EscPosCommands.FEED -> {
                    requireNoPendingText("ESC d");
                    out.add(new PrintInstruction.Feed(next()));
                }
                case EscPosCommands.BUZZER -> {
                    requireNoPendingText("ESC B");
                    int times = next();
                    int units = next();
                    out.add(new PrintInstruction.Buzzer(times, Duration.ofMillis(units * 100L)));
                }
                default -> throw new PrinterCommandDecodeException(
                        String.format("Unknown ESC command 0x%02X at offset %d", cmd, pos - 1));
            }
        }

        private void gs() {
            int cmd = next();
            switch (cmd) {
                case EscPosCommands.CHAR_SIZE -> {
                    int n = next();
                    size = TextSize.of((n & 0x0F) != 0, (n & 0xF0) != 0);
                }
                case EscPosCommands.INVERSE -> inverse = (next() & 0x01) != 0;
                case EscPosCommands.CUT -> {
                    requireNoPendingText("GS V");
                    int m = next();
                    if (m == EscPosCommands.CUT_FULL_FEED || m == EscPosCommands.CUT_PARTIAL_FEED) {
                        next(); // feed amount
                    }
                    out.add(new PrintInstruction.Cut(
                            m == EscPosCommands.CUT_PARTIAL_FEED || m == 1 || m == '1'));
                }
                default -> throw new PrinterCommandDecodeException(
                        String.format("Unknown GS command 0x%02X at offset %d", cmd, pos - 1));
            }
        }

        private Alignment alignment(int n) {
            return switch (n) {
                case 0, '0' -> Alignment.LEFT;
                case 1, '1' -> Alignment.CENTER;
                case 2, '2' -> Alignment.RIGHT;
                default -> throw new PrinterCommandDecodeException("Invalid alignment " + n);
            };
        }

        private void requireNoPendingText(String command) {
            if (text.length() > 0) {
                throw new PrinterCommandDecodeException(command + " inside a text line: '" + text + "'");
            }
        }

        private int next() {
            if (pos >= in.length) {
                throw new PrinterCommandDecodeException("Truncated command at offset " + pos);
            }
            return in[pos++] & 0xFF;
        }
    }
}
