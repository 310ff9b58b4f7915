package com.questrail.kitchen.print.codec.impl;

/**
 * Indicates that a payload is not a well-formed ESC/POS command stream.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unknown command after ESC or GS</li>
 *   <li>A command truncated before its parameters</li>
 *   <li>Text left without a terminating line feed</li>
 * </ul>
 */
public final class PrinterCommandDecodeException extends RuntimeException
{
    public PrinterCommandDecodeException(String message) {
        super(message);
    }

    public PrinterCommandDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
