package com.questrail.kitchen.dispatch;

/**
 * Result of one delivery attempt to one target.
 */
public enum AttemptOutcome
{
    /** Printer answered with a ready status. */
    ACKNOWLEDGED,
    /** Display entry placed on the station channel. */
    PUBLISHED,
    /** No status byte within the attempt timeout. */
    TIMED_OUT,
    /** Connect, write or read failed. */
    TRANSPORT_ERROR,
    /** Printer answered but reports itself offline. */
    PRINTER_NOT_READY
}
