package com.questrail.kitchen.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements RoutingObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onManifestResolved(ManifestResolvedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onConfigurationWarning(ConfigurationWarningEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPrintJobTerminal(PrintJobTerminalEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDispatchCompleted(DispatchCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onCancellationNote(CancellationNoteEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(RoutingErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
