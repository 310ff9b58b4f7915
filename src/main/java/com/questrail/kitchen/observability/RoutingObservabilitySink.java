package com.questrail.kitchen.observability;

/**
 * Main interface for receiving routing and dispatch observability events.
 * Implementations can provide logging, metrics, or an audit trail.
 *
 * <p>Implementations must not throw and must be thread-safe: events arrive
 * from dispatch worker threads.</p>
 */
public interface RoutingObservabilitySink {
    /**
     * Called once per resolved send action, including the unrouted bucket.
     */
    void onManifestResolved(ManifestResolvedEvent event);

    /**
     * Called for each configuration problem of a newly seen registry version.
     */
    void onConfigurationWarning(ConfigurationWarningEvent event);

    /**
     * Called when a print job reaches a terminal state.
     */
    void onPrintJobTerminal(PrintJobTerminalEvent event);

    /**
     * Called when every destination of a send action is terminal.
     */
    void onDispatchCompleted(DispatchCompletedEvent event);

    /**
     * Called when a cancellation could not retract a ticket.
     */
    void onCancellationNote(CancellationNoteEvent event);

    void onError(RoutingErrorEvent event);
}
