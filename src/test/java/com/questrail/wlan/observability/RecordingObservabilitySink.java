package com.questrail.wlan.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements GuardrailObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onAccessPointRegistered(AccessPointRegisteredEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onChangeEvaluated(ChangeEvaluatedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onStateChange(AccessPointStateChangeEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onLookupFailure(LookupFailureEvent event) {
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

    public synchronized void clear() {
        events.clear();
    }
}
