package com.questrail.chat.protocol.internal.reliability;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * PeerAddressBinding
 * -----------------------------------------------------------------------------
 * Destination address for outbound datagrams.
 *
 * <p>Starts as the configured server address. Until the session is
 * authenticated, every inbound datagram rebinds it to that datagram's source,
 * since servers answer handshake traffic from a per-session port. Once
 * authenticated, the binding is frozen.</p>
 *
 * <p>Not thread-safe; guarded by {@link ReliabilityEngine}.</p>
 */
public final class PeerAddressBinding
{
    private final SocketAddress configured;
    private SocketAddress current;

    public PeerAddressBinding(SocketAddress configured) {
        this.configured = Objects.requireNonNull(configured, "configured");
        this.current = configured;
    }

    public SocketAddress configured() {
        return configured;
    }

    public SocketAddress current() {
        return current;
    }

    /**
     * Observe the source of an inbound datagram.
     *
     * @return {@code true} if the binding changed
     */
    public boolean observe(SocketAddress source, boolean authenticated) {
        Objects.requireNonNull(source, "source");
        if (authenticated || source.equals(current)) {
            return false;
        }
        current = source;
        return true;
    }
}
