package com.questrail.chat.protocol.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * ChatTimingPolicy
 * -----------------------------------------------------------------------------
 * Every timeout and retry bound the client applies.
 *
 * <ul>
 *   <li><b>confirmationTimeout</b>: wait for a datagram acknowledgment before retransmitting.</li>
 *   <li><b>maxRetransmissions</b>: retransmissions after the first datagram send; once spent,
 *       the frame goes out one final time unacknowledged.</li>
 *   <li><b>authReplyTimeout</b> / <b>joinReplyTimeout</b>: wait for the Reply to an
 *       authenticate / join request.</li>
 *   <li><b>connectTimeout</b>: transport start.</li>
 *   <li><b>farewellTimeout</b>, <b>flushTimeout</b>, <b>disconnectTimeout</b>: the three
 *       shutdown stages (notify peer, flush, close).</li>
 * </ul>
 */
public record ChatTimingPolicy(
        Duration confirmationTimeout,
        int maxRetransmissions,
        Duration authReplyTimeout,
        Duration joinReplyTimeout,
        Duration connectTimeout,
        Duration farewellTimeout,
        Duration flushTimeout,
        Duration disconnectTimeout
) {
    public ChatTimingPolicy {
        requireNonNegative(confirmationTimeout, "confirmationTimeout");
        requireNonNegative(authReplyTimeout, "authReplyTimeout");
        requireNonNegative(joinReplyTimeout, "joinReplyTimeout");
        requireNonNegative(connectTimeout, "connectTimeout");
        requireNonNegative(farewellTimeout, "farewellTimeout");
        requireNonNegative(flushTimeout, "flushTimeout");
        requireNonNegative(disconnectTimeout, "disconnectTimeout");

        if (maxRetransmissions < 0) {
            throw new IllegalArgumentException("maxRetransmissions must be non-negative");
        }
    }

    /**
     * Defaults: 250 ms acknowledgment wait, 3 retransmissions, 15 s / 5 s reply
     * timeouts, 5 s connect, 1 s / 500 ms / 1 s shutdown stages.
     */
    public static ChatTimingPolicy defaults() {
        return new ChatTimingPolicy(
                Duration.ofMillis(250),
                3,
                Duration.ofSeconds(15),
                Duration.ofSeconds(5),
                Duration.ofSeconds(5),
                Duration.ofSeconds(1),
                Duration.ofMillis(500),
                Duration.ofSeconds(1)
        );
    }

    /**
     * Returns a copy with the datagram acknowledgment settings replaced, as
     * supplied at the command-line boundary.
     */
    public ChatTimingPolicy withConfirmation(Duration timeout, int retransmissions) {
        return new ChatTimingPolicy(timeout, retransmissions, authReplyTimeout, joinReplyTimeout,
                connectTimeout, farewellTimeout, flushTimeout, disconnectTimeout);
    }

    /**
     * Upper bound of the whole shutdown sequence.
     */
    public Duration shutdownBudget() {
        return farewellTimeout.plus(flushTimeout).plus(disconnectTimeout);
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
