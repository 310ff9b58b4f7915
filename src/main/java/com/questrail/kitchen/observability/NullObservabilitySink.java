package com.questrail.kitchen.observability;

/**
 * Sink that discards every event.
 */
public final class NullObservabilitySink implements RoutingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onManifestResolved(ManifestResolvedEvent event) {}

    @Override
    public void onConfigurationWarning(ConfigurationWarningEvent event) {}

    @Override
    public void onPrintJobTerminal(PrintJobTerminalEvent event) {}

    @Override
    public void onDispatchCompleted(DispatchCompletedEvent event) {}

    @Override
    public void onCancellationNote(CancellationNoteEvent event) {}

    @Override
    public void onError(RoutingErrorEvent event) {}
}
