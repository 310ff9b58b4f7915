/**
 * Printer transport port.
 *
 * <p>The dispatch service only sees {@link com.questrail.kitchen.transport.PrinterTransport};
 * the Netty implementation lives in {@code transport.netty} and no Netty type
 * leaves that package.</p>
 */
package com.questrail.kitchen.transport;
