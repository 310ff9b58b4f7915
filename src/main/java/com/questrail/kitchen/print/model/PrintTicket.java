package com.questrail.kitchen.print.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, immutable list of print instructions for one station.
 */
public record PrintTicket(List<PrintInstruction> instructions)
{
    public PrintTicket {
        instructions = List.copyOf(Objects.requireNonNull(instructions, "instructions"));
    }

    /**
     * Text of every {@link PrintInstruction.TextLine}, in order.
     */
    public List<String> textLines() {
        List<String> out = new ArrayList<>();
        for (PrintInstruction i : instructions) {
            if (i instanceof PrintInstruction.TextLine line) {
                out.add(line.text());
            }
        }
        return out;
    }

    public boolean contains(Class<? extends PrintInstruction> type) {
        for (PrintInstruction i : instructions) {
            if (type.isInstance(i)) {
                return true;
            }
        }
        return false;
    }
}
