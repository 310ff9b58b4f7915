package com.questrail.kitchen.transport;

/**
 * Printer status byte returned after a ticket was written
 * ({@code DLE EOT 1} real-time status).
 *
 * <p>Bit 3 set means the printer is offline (cover open, paper out, error),
 * so the ticket cannot be assumed printed.</p>
 */
public record PrinterAck(int status)
{
    public static final int OFFLINE = 0x08;

    public PrinterAck {
        if (status < 0 || status > 0xFF) {
            throw new IllegalArgumentException("status must be a byte value (was " + status + ")");
        }
    }

    public static PrinterAck online() {
        return new PrinterAck(0x12);
    }

    public static PrinterAck offline() {
        return new PrinterAck(0x12 | OFFLINE);
    }

    public boolean ready() {
        return (status & OFFLINE) == 0;
    }

    @Override
    public String toString() {
        return String.format("PrinterAck[0x%02X %s]", status, ready() ? "ready" : "offline");
    }
}
