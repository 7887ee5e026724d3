package com.questrail.chat.protocol.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything the session state machine consumes.
 *
 * <p>Events are the only way information enters the session core:</p>
 * <ul>
 *   <li>user commands ({@link SessionCommandEvent})</li>
 *   <li>normalized inbound messages and malformed input ({@link SessionMessageEvent})</li>
 *   <li>transport faults ({@link SessionTransportEvent})</li>
 *   <li>reply timeouts ({@link SessionTimeoutEvent})</li>
 * </ul>
 *
 * <p>Events are immutable and carry only the information needed to advance state.</p>
 */
public interface SessionEvent
{
    /**
     * Time at which the event was generated. Observational only.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements SessionEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
