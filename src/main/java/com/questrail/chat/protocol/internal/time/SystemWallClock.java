package com.questrail.chat.protocol.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for event and log timestamps.
 *
 * <p><strong>Not for timing decisions.</strong> Timeouts use {@link MonotonicClock}.</p>
 */
public enum SystemWallClock {
    INSTANCE;

    public Instant now() {
        return Instant.now();
    }
}
