package com.questrail.kitchen.api;

/**
 * StationKind
 * -----------------------------------------------------------------------------
 * The delivery mechanism behind a station.
 *
 * <p>The kind decides how the dispatch layer delivers a manifest entry. It has
 * no influence on routing: displays and printers match tags the same way.</p>
 */
public enum StationKind
{
    /**
     * A kitchen display. Entries are published on the station's channel;
     * delivery is best-effort and at-most-once per connected subscriber.
     */
    DISPLAY,

    /**
     * A physical printer. Entries become print jobs that are retried until
     * the printer acknowledges them or the retry budget is spent.
     */
    PRINTER
}
