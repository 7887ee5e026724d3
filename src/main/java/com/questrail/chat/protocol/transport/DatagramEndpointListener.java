package com.questrail.chat.protocol.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty-backed endpoints deliver them on
 * the channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * The socket is bound and usable.
     */
    void onTransportUp();

    /**
     * The socket became unusable.
     *
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete datagram, copied out of any framework buffer.
     *
     * @param remote  source address of the datagram
     * @param payload raw payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
