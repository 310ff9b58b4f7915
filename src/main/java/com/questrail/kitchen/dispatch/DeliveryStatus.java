package com.questrail.kitchen.dispatch;

/**
 * Per-destination status in a dispatch report.
 */
public enum DeliveryStatus
{
    /** Printer acknowledged the ticket. */
    DELIVERED,
    /** Display entry published to the station channel. */
    PUBLISHED,
    /** Retries exhausted, no backup printer took over. */
    FAILED,
    /** Primary printer failed; the backup printer acknowledged the ticket. */
    FAILED_OVER,
    /** The ticket could not be built. */
    BUILD_FAILED,
    /** Cancelled before it printed. */
    CANCELLED,
    /** Waiting for the next attempt. Only seen in progress snapshots. */
    PENDING_RETRY,
    /** Attempt under way. Only seen in progress snapshots. */
    IN_PROGRESS;

    public boolean delivered() {
        return this == DELIVERED || this == PUBLISHED || this == FAILED_OVER;
    }

    public boolean terminal() {
        return this != PENDING_RETRY && this != IN_PROGRESS;
    }
}
