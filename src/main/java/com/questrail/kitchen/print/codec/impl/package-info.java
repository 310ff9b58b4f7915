/**
 * ESC/POS implementations of the printer command codec.
 *
 * <p>Command bytes live in {@code EscPosCommands}. The two encoders share the
 * instruction walk in {@code AbstractEscPosEncoder} and differ only in how
 * bold, size and colour attributes are switched.</p>
 */
package com.questrail.kitchen.print.codec.impl;
