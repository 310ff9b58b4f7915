package com.questrail.kitchen.print.codec.impl;

/**
 * Raised when a ticket uses an attribute the target dialect cannot print,
 * such as inverse text on an impact printer.
 */
public final class UnsupportedPrinterCommandException extends RuntimeException
{
    public UnsupportedPrinterCommandException(String message) {
        super(message);
    }
}
