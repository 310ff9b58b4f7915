package com.questrail.kitchen.transport;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * PrinterTransport
 * -----------------------------------------------------------------------------
 * Port for delivering an encoded ticket to a network printer.
 *
 * <p>One call to {@link #send} is one delivery attempt: write the payload,
 * then wait for the printer's status byte. The transport never retries and
 * never schedules anything; the dispatch service owns retry, backoff and
 * attempt timeouts.</p>
 *
 * <p>Implementations may be backed by Netty, a local driver, or a test fake.</p>
 */
public interface PrinterTransport
{
    /**
     * Acquire transport resources. Must be called before {@link #send}.
     */
    void start();

    /**
     * Release all transport resources. In-flight attempts fail with
     * {@link PrinterTransportException}.
     */
    void stop();

    boolean isRunning();

    /**
     * Write {@code payload} to the printer at {@code printer} and ask for its status.
     *
     * <p>The future completes with the status byte, or exceptionally with
     * {@link PrinterTransportException} when the printer cannot be reached or
     * closes the connection without answering. Cancelling the future abandons
     * the attempt and closes its connection.</p>
     */
    CompletableFuture<PrinterAck> send(InetSocketAddress printer, byte[] payload);
}
