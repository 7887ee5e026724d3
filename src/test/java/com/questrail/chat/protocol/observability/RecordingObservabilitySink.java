package com.questrail.chat.protocol.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ChatObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ChatStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolEvent(ChatProtocolEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(ChatTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ChatErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ChatStateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof ChatStateTransitionEvent)
            .map(e -> (ChatStateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized long countProtocolEvents(ChatProtocolEvent.Kind kind) {
        return events.stream()
            .filter(e -> e instanceof ChatProtocolEvent p && p.kind() == kind)
            .count();
    }

    public synchronized long countTransportEvents(ChatTransportEvent.Kind kind) {
        return events.stream()
            .filter(e -> e instanceof ChatTransportEvent t && t.kind() == kind)
            .count();
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
