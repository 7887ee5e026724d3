package com.questrail.chat.protocol.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every timing decision the client makes.
 *
 * <h2>Binding invariant</h2>
 * Acknowledgment timeouts, reply timeouts and shutdown stage bounds MUST be
 * computed from this clock. Wall-clock time is permitted only for event
 * timestamps (see {@link SystemWallClock}).
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
