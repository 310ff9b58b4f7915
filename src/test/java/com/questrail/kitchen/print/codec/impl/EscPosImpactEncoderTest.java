package com.questrail.kitchen.print.codec.impl;

import com.questrail.kitchen.config.PrinterType;
import com.questrail.kitchen.print.model.Alignment;
import com.questrail.kitchen.print.model.PrintInstruction;
import com.questrail.kitchen.print.model.PrintTicket;
import com.questrail.kitchen.print.model.TextSize;
import com.questrail.kitchen.print.model.TextStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EscPosImpactEncoderTest {

    private final EscPosImpactEncoder encoder = new EscPosImpactEncoder();

    @Test
    void boldAndSizeShareOnePrintModeByte() {
        TextStyle style = new TextStyle(true, TextSize.DOUBLE_SIZE, Alignment.LEFT, false, false);
        byte[] encoded = encoder.encode(new PrintTicket(List.of(new PrintInstruction.TextLine("A", style))));

        assertArrayEquals(new byte[] {0x1B, '!', 0x38, 'A', 0x0A}, encoded);
    }

    @Test
    void redRibbonIsSelectedAndReleased() {
        byte[] encoded = encoder.encode(new PrintTicket(List.of(
                new PrintInstruction.TextLine("NO", TextStyle.PLAIN.withRed(true)),
                PrintInstruction.TextLine.plain("ok"))));

        assertArrayEquals(new byte[] {0x1B, '4', 'N', 'O', 0x0A, 0x1B, '5', 'o', 'k', 0x0A}, encoded);
    }

    @Test
    void inverseTextIsRejected() {
        PrintTicket ticket = new PrintTicket(List.of(
                new PrintInstruction.TextLine("x", TextStyle.PLAIN.withInverse(true))));
        assertThrows(UnsupportedPrinterCommandException.class, () -> encoder.encode(ticket));
    }

    @Test
    void encoderIsChosenByPrinterType() {
        assertInstanceOf(EscPosImpactEncoder.class, PrinterEncoders.forType(PrinterType.IMPACT));
        assertInstanceOf(EscPosThermalEncoder.class, PrinterEncoders.forType(PrinterType.THERMAL));
    }
}
