package com.questrail.kitchen.dispatch;

/**
 * Delivery state of a print job.
 *
 * <pre>
 *   PENDING --attempt--> SENT --status ok--> ACKNOWLEDGED
 *      ^                  |
 *      +----backoff-------+ failure, attempts left
 *                         +-- failure, exhausted --> FAILED
 *   PENDING / SENT --cancel--> CANCELLED
 * </pre>
 */
public enum PrintJobState
{
    PENDING,
    SENT,
    ACKNOWLEDGED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == ACKNOWLEDGED || this == FAILED || this == CANCELLED;
    }
}
