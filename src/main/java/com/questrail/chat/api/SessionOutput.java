package com.questrail.chat.api;

import com.questrail.chat.protocol.model.TerminationCause;

/**
 * SessionOutput
 * -----------------------------------------------------------------------------
 * User-visible effects of a chat session.
 *
 * <p>Implemented by the layer that renders output for a person (console,
 * UI, test recorder). Callbacks are invoked from engine threads and must not
 * block.</p>
 */
public interface SessionOutput
{
    /** A chat message from another participant. */
    void onChatMessage(String sender, String content);

    /** The outcome of the last authenticate or join request. */
    void onReply(boolean success, String content);

    /** The server reported an error; the session is terminating. */
    void onRemoteError(String sender, String content);

    /** A command was rejected locally, or a local fault occurred. */
    void onLocalError(String description);

    /** The session has fully shut down. Invoked exactly once. */
    void onTerminated(TerminationCause cause);
}
