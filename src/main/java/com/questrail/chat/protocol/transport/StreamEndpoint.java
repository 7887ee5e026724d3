package com.questrail.chat.protocol.transport;

import java.util.concurrent.CompletableFuture;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a line-oriented byte stream connection.
 *
 * <p>The endpoint splits inbound bytes into lines and writes outbound text as
 * given; it has no knowledge of the chat grammar.</p>
 */
public interface StreamEndpoint
{
    /**
     * Open the connection.
     *
     * <p>On success the endpoint notifies {@link StreamEndpointListener#onConnected()};
     * on failure {@link StreamEndpointListener#onDisconnected(Throwable)} with the cause.</p>
     */
    void connect();

    /**
     * Write {@code text} (which already carries its line terminator).
     *
     * @return completes when the write is flushed to the socket, exceptionally on failure
     */
    CompletableFuture<Void> send(String text);

    /**
     * Close the connection and release all transport resources.
     *
     * @return completes once resources are released
     */
    CompletableFuture<Void> close();

    /**
     * Register the listener. Must be called before {@link #connect()}.
     */
    void setListener(StreamEndpointListener listener);
}
