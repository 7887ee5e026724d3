package com.questrail.chat.protocol.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Protocol-level activity below the session state machine.
 *
 * @param messageId datagram message identifier, or {@code -1} on the stream transport
 * @param detail    human-readable description (frame text, addresses, ...)
 */
public record ChatProtocolEvent(
    Instant timestamp,
    Kind kind,
    int messageId,
    String detail
) {
    public enum Kind {
        FRAME_SENT,
        FRAME_RECEIVED,
        ACKNOWLEDGED,
        RETRANSMISSION,
        UNCONFIRMED_DELIVERY,
        DUPLICATE_SUPPRESSED,
        PEER_REBOUND
    }

    public ChatProtocolEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    /**
     * Per-frame traffic, as opposed to reliability anomalies.
     */
    public boolean isTraffic() {
        return kind == Kind.FRAME_SENT || kind == Kind.FRAME_RECEIVED || kind == Kind.ACKNOWLEDGED;
    }

    @Override
    public String toString() {
        return messageId < 0
                ? kind + " " + detail
                : kind + " #" + messageId + " " + detail;
    }
}
