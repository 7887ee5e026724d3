package com.questrail.chat.protocol.transport;

/**
 * Callback sink for {@link StreamEndpoint}. Callbacks are delivered serially.
 */
public interface StreamEndpointListener
{
    void onConnected();

    /**
     * The connection ended.
     *
     * @param cause diagnostic cause; {@code null} when the peer closed the connection
     *              or the endpoint was closed locally
     */
    void onDisconnected(Throwable cause);

    /**
     * One inbound line, line terminator removed.
     */
    void onLine(String line);

    /**
     * An inbound line was dropped without being delivered, for example because
     * it exceeded the endpoint's line limit. The connection stays open.
     */
    void onDiscardedLine(String reason);
}
