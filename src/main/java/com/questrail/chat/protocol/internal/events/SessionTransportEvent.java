package com.questrail.chat.protocol.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Events that originate from the transport layer rather than from the peer.
 */
public sealed interface SessionTransportEvent extends SessionEvent
        permits SessionTransportEvent.ConnectionLost
{
    /** The transport became unusable (unreachable, reset, closed by the server). */
    final class ConnectionLost extends SessionEvent.Base implements SessionTransportEvent {
        private final String description;

        public ConnectionLost(Instant timestamp, String description) {
            super(timestamp);
            this.description = Objects.requireNonNull(description, "description");
        }

        public String description() {
            return description;
        }
    }
}
