package com.questrail.chat.protocol.internal.events;

import com.questrail.chat.protocol.internal.state.PendingRequest;

import java.time.Instant;
import java.util.Objects;

/**
 * Events injected by the timed executor when an awaited signal does not arrive.
 */
public sealed interface SessionTimeoutEvent extends SessionEvent
        permits SessionTimeoutEvent.ReplyTimeout
{
    /** No Reply arrived for {@code request} within its reply timeout. */
    final class ReplyTimeout extends SessionEvent.Base implements SessionTimeoutEvent {
        private final PendingRequest request;

        public ReplyTimeout(Instant timestamp, PendingRequest request) {
            super(timestamp);
            this.request = Objects.requireNonNull(request, "request");
        }

        public PendingRequest request() {
            return request;
        }
    }
}
