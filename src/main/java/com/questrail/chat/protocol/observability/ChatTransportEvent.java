package com.questrail.chat.protocol.observability;

import java.time.Instant;

/**
 * Transport lifecycle change. {@code detail} is diagnostic only.
 */
public record ChatTransportEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        UP,
        DOWN,
        FAULT
    }
}
