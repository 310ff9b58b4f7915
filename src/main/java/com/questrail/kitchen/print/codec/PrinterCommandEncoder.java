package com.questrail.kitchen.print.codec;

import com.questrail.kitchen.print.model.PrintTicket;

/**
 * PrinterCommandEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for one printer command dialect.
 *
 * <p>This is the outbound boundary between an abstract {@link PrintTicket} and
 * the raw bytes a printer transport writes to the device. The encoder does not
 * decide what goes on the ticket; the template factory does. It only maps
 * instructions to control codes.</p>
 *
 * <p>Implementations are stateless and thread-safe. An instruction the dialect
 * cannot express raises
 * {@link com.questrail.kitchen.print.codec.impl.UnsupportedPrinterCommandException}.</p>
 */
public interface PrinterCommandEncoder
{
    /**
     * Encode a ticket into a payload ready for immediate transmission.
     */
    byte[] encode(PrintTicket ticket);
}
