package com.questrail.kitchen.dispatch;

import java.util.List;
import java.util.Objects;

/**
 * Result of cancelling an order or some of its items.
 *
 * @param cancelled jobs stopped before anything printed
 * @param notes     jobs that could not be stopped, and why
 */
public record CancellationResult(String orderId, List<PrintJobId> cancelled, List<CancellationNote> notes)
{
    public CancellationResult {
        Objects.requireNonNull(orderId, "orderId");
        cancelled = List.copyOf(cancelled);
        notes = List.copyOf(notes);
    }

    public boolean nothingToCancel() {
        return cancelled.isEmpty() && notes.isEmpty();
    }
}
