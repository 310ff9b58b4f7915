package com.questrail.kitchen.print.model;

import java.time.Duration;
import java.util.Objects;

/**
 * PrintInstruction
 * -----------------------------------------------------------------------------
 * One abstract step of a printer ticket.
 *
 * <p>Instructions are protocol-neutral. A {@code PrinterCommandEncoder} maps
 * them to the bytes of a concrete printer family. Text is plain ASCII; any
 * other character is replaced by {@code '?'} when encoded.</p>
 */
public sealed interface PrintInstruction
        permits PrintInstruction.Initialize,
                PrintInstruction.TextLine,
                PrintInstruction.Feed,
                PrintInstruction.Cut,
                PrintInstruction.Buzzer
{
    /** Reset the printer to its power-on state. */
    record Initialize() implements PrintInstruction {
        public static final Initialize INSTANCE = new Initialize();
    }

    /** One line of text followed by a line feed. */
    record TextLine(String text, TextStyle style) implements PrintInstruction {
        public TextLine {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(style, "style");
            if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("TextLine must not contain line breaks");
            }
        }

        public static TextLine plain(String text) {
            return new TextLine(text, TextStyle.PLAIN);
        }
    }

    /** Advance the paper by {@code lines} blank lines. */
    record Feed(int lines) implements PrintInstruction {
        public Feed {
            if (lines < 1 || lines > 255) {
                throw new IllegalArgumentException("Feed lines must be in [1,255] (was " + lines + ")");
            }
        }
    }

    /** Cut the paper, leaving a small uncut strip when {@code partial}. */
    record Cut(boolean partial) implements PrintInstruction {
    }

    /**
     * Sound the buzzer {@code times} times, each for {@code pulse}.
     * ESC/POS expresses the pulse in 100 ms units, from 1 to 9.
     */
    record Buzzer(int times, Duration pulse) implements PrintInstruction {
        public Buzzer {
            Objects.requireNonNull(pulse, "pulse");
            if (times < 1 || times > 9) {
                throw new IllegalArgumentException("Buzzer times must be in [1,9] (was " + times + ")");
            }
            long units = pulse.toMillis() / 100;
            if (units < 1 || units > 9 || pulse.toMillis() % 100 != 0) {
                throw new IllegalArgumentException("Buzzer pulse must be 100..900 ms in 100 ms steps (was " + pulse + ")");
            }
        }

        public int pulseUnits() {
            return (int) (pulse.toMillis() / 100);
        }
    }
}
