package com.questrail.kitchen.print.codec;

import com.questrail.kitchen.print.model.PrintTicket;

/**
 * PrinterCommandDecoder
 * -----------------------------------------------------------------------------
 * Inverse of {@link PrinterCommandEncoder}, used by tests and diagnostics to
 * inspect what a payload will print.
 *
 * <p>The input is treated as one complete payload; there is no accumulation
 * across calls. Malformed input raises
 * {@link com.questrail.kitchen.print.codec.impl.PrinterCommandDecodeException}.</p>
 */
public interface PrinterCommandDecoder
{
    PrintTicket decode(byte[] payload);
}
