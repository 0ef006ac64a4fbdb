package com.questrail.diagnostics.protocol.uds.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements UdsObservabilitySink {
    private final List<Object> events = new ArrayList<>();
    private final List<Object> sent = new ArrayList<>();

    @Override
    public synchronized void onFrameSent(UdsFrameEvent event) {
        events.add(event);
        sent.add(event);
    }

    @Override
    public synchronized void onFrameReceived(UdsFrameEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(UdsTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(UdsErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<UdsFrameEvent> getSentFrames() {
        return sent.stream()
            .map(e -> (UdsFrameEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<UdsTransportEvent.Kind> getTransportKinds() {
        return events.stream()
            .filter(e -> e instanceof UdsTransportEvent)
            .map(e -> ((UdsTransportEvent) e).kind())
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
