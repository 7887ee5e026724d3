package com.questrail.chat.protocol.internal.events;

import com.questrail.chat.protocol.model.NormalizedMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * Inbound protocol input, already decoded (or rejected) by a transport.
 */
public sealed interface SessionMessageEvent extends SessionEvent
        permits SessionMessageEvent.MessageReceived, SessionMessageEvent.MalformedReceived
{
    /** A well-formed, deduplicated inbound message. */
    final class MessageReceived extends SessionEvent.Base implements SessionMessageEvent {
        private final NormalizedMessage message;

        public MessageReceived(Instant timestamp, NormalizedMessage message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message");
        }

        public NormalizedMessage message() {
            return message;
        }
    }

    /** Inbound input that could not be decoded or failed field validation. */
    final class MalformedReceived extends SessionEvent.Base implements SessionMessageEvent {
        private final String reason;

        public MalformedReceived(Instant timestamp, String reason) {
            super(timestamp);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public String reason() {
            return reason;
        }
    }
}
