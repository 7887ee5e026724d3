package com.questrail.chat.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of {@link ChatObservabilitySink} that emits logs via SLF4J.
 *
 * <p>In verbose mode frame traffic is logged at INFO; otherwise at DEBUG.
 * Reliability anomalies (retransmission, unconfirmed delivery, rebinding) are
 * always INFO or WARN.</p>
 */
public final class Slf4jChatObservabilitySink implements ChatObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChatObservabilitySink.class);

    private final boolean verbose;

    public Slf4jChatObservabilitySink(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void onStateTransition(ChatStateTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Session: {} -> {} on {} after {} ms",
                event.oldState().phase(),
                event.newState().phase(),
                event.triggeringEvent().getClass().getSimpleName(),
                event.sinceLastTransition().toMillis());
        }
        if (event.isChannelChange()) {
            log.info("Channel: {} -> {}",
                event.oldState().confirmedChannel().orElse("-"),
                event.newState().confirmedChannel().orElse("-"));
        }
        if (verbose && !event.resultingIntents().isEmpty()) {
            log.info("Intents: {}", event.resultingIntents());
        }
    }

    @Override
    public void onProtocolEvent(ChatProtocolEvent event) {
        switch (event.kind()) {
            case UNCONFIRMED_DELIVERY -> log.warn("Protocol: {}", event);
            case RETRANSMISSION, PEER_REBOUND, DUPLICATE_SUPPRESSED -> log.info("Protocol: {}", event);
            default -> {
                if (verbose) {
                    log.info("Protocol: {}", event);
                } else {
                    log.debug("Protocol: {}", event);
                }
            }
        }
    }

    @Override
    public void onTransportEvent(ChatTransportEvent event) {
        if (event.kind() == ChatTransportEvent.Kind.FAULT) {
            log.warn("Transport {}: {}", event.kind(), event.detail());
        } else {
            log.info("Transport {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(ChatErrorEvent event) {
        log.error("Chat client error: {}", event.message(), event.cause());
    }
}
