package com.questrail.chat.protocol.observability;

/**
 * Receives observability events from the chat protocol engine.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ChatObservabilitySink {
    /**
     * Called after the session controller applied an event.
     */
    void onStateTransition(ChatStateTransitionEvent event);

    /**
     * Called for protocol-level activity: frames sent and received,
     * retransmissions, unconfirmed deliveries, duplicate suppression,
     * peer address rebinding.
     */
    void onProtocolEvent(ChatProtocolEvent event);

    /**
     * Called when a transport comes up, goes down, or faults.
     */
    void onTransportEvent(ChatTransportEvent event);

    /**
     * Called when an error or anomaly occurs in the engine.
     */
    void onError(ChatErrorEvent event);
}
