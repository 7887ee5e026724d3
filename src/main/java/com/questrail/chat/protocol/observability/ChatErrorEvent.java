package com.questrail.chat.protocol.observability;

import java.time.Instant;

/**
 * An error or anomaly in the chat protocol engine. {@code cause} may be null.
 */
public record ChatErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
