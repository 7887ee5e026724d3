package com.questrail.chat.api;

import com.questrail.chat.protocol.model.TerminationCause;

import java.time.Duration;
import java.util.Optional;

/**
 * ChatClient
 * -----------------------------------------------------------------------------
 * Transport-neutral handle on one chat session.
 *
 * <p>Commands never block on the network. Outcomes, including local
 * rejections, are reported through {@link SessionOutput}.</p>
 */
public interface ChatClient
{
    /**
     * Authenticate with the server and adopt {@code displayName} for later frames.
     */
    void authenticate(String username, String secret, String displayName);

    /**
     * Request a move to {@code channel}.
     */
    void join(String channel);

    /**
     * Send a chat message to the current channel.
     */
    void sendMessage(String content);

    /**
     * Change the display name used for subsequent frames. Purely local.
     */
    void rename(String displayName);

    /**
     * Leave the session gracefully.
     */
    void leave();

    /**
     * Returns the current phase of the session.
     */
    SessionPhase phase();

    /**
     * Returns the channel confirmed by the server, if any.
     */
    Optional<String> channel();

    /**
     * Returns the display name in use, if one has been set.
     */
    Optional<String> displayName();

    /**
     * Waits for the session to finish shutting down.
     *
     * @return the termination cause, or empty if {@code timeout} elapsed first
     */
    Optional<TerminationCause> awaitTermination(Duration timeout) throws InterruptedException;
}
