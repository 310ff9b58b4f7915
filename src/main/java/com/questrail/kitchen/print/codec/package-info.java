/**
 * Printer Command Codec
 * =============================================================================
 *
 * <p>Maps abstract {@link com.questrail.kitchen.print.model.PrintTicket}s to
 * ESC/POS byte streams and back.</p>
 *
 * <pre>
 *   RoutingManifestEntry
 *        → PrintTemplateFactory     (what to print, layout rules)
 *            → PrintTicket          (abstract instructions)
 *                → PrinterCommandEncoder   (dialect bytes applied here)
 *                    → byte[] payload → PrinterTransport
 * </pre>
 *
 * <h2>Dialects</h2>
 * <ul>
 *   <li>Thermal: ESC E bold, GS ! size, GS B inverse.</li>
 *   <li>Impact: ESC ! for bold and size together, ESC 4 / ESC 5 red and black ribbon.</li>
 * </ul>
 *
 * <p>Both dialects share ESC @, ESC a, LF, ESC d, GS V and ESC B. One decoder
 * reads either dialect.</p>
 */
package com.questrail.kitchen.print.codec;
