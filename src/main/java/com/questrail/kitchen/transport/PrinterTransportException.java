package com.questrail.kitchen.transport;

/**
 * A delivery attempt failed below the ticket level: connection refused,
 * connection reset, transport stopped. Always retryable.
 */
public final class PrinterTransportException extends RuntimeException
{
    public PrinterTransportException(String message) {
        super(message);
    }

    public PrinterTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
