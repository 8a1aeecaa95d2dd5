package com.questrail.opcua.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements CodecObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onError(CodecErrorEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onOpaqueBody(OpaqueBodyEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<CodecErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof CodecErrorEvent)
            .map(e -> (CodecErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<OpaqueBodyEvent> getOpaqueBodies() {
        return events.stream()
            .filter(e -> e instanceof OpaqueBodyEvent)
            .map(e -> (OpaqueBodyEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
