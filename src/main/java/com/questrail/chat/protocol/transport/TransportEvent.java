package com.questrail.chat.protocol.transport;

import com.questrail.chat.protocol.model.NormalizedMessage;

import java.util.Objects;

/**
 * What a {@link ProtocolTransport} publishes upward: decoded messages,
 * malformed input, and (at most once) a fault.
 */
public sealed interface TransportEvent
        permits TransportEvent.Received, TransportEvent.Malformed, TransportEvent.Fault
{
    record Received(NormalizedMessage message) implements TransportEvent {
        public Received {
            Objects.requireNonNull(message, "message");
        }
    }

    record Malformed(String reason, String raw) implements TransportEvent {
        public Malformed {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(raw, "raw");
        }
    }

    /**
     * @param cause may be {@code null} (e.g. connection closed by the server)
     */
    record Fault(String description, Throwable cause) implements TransportEvent {
        public Fault {
            Objects.requireNonNull(description, "description");
        }
    }
}
