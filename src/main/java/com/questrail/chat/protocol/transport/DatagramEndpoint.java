package com.questrail.chat.protocol.transport;

import java.net.SocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram socket.
 *
 * <p>The endpoint moves opaque {@code byte[]} payloads. Framing, acknowledgment,
 * deduplication and peer selection all live above it, in
 * {@code UdpProtocolTransport} and the reliability engine.</p>
 *
 * <p>Implementations may be backed by Netty or by a test fake.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the socket and begin receiving datagrams.
     *
     * <p>On success the endpoint notifies {@link DatagramEndpointListener#onTransportUp()};
     * on failure {@link DatagramEndpointListener#onTransportDown(Throwable)} with the cause.</p>
     */
    void start();

    /**
     * Close the socket and release all transport resources.
     *
     * @return completes once resources are released
     */
    CompletableFuture<Void> stop();

    /**
     * Send one datagram. Silently dropped if the endpoint is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener for inbound datagrams and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
