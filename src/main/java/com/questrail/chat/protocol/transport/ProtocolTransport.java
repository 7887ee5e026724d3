package com.questrail.chat.protocol.transport;

import com.questrail.chat.protocol.model.DeliveryOutcome;
import com.questrail.chat.protocol.model.OutboundCommand;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * ProtocolTransport
 * -----------------------------------------------------------------------------
 * Uniform outbound/inbound contract shared by the stream and datagram bindings.
 *
 * <h2>Outbound</h2>
 * Every send returns a future {@link DeliveryOutcome}. The stream binding
 * reports {@code DELIVERED} once the line is flushed; the datagram binding once
 * the peer acknowledged it, or {@code UNCONFIRMED} after the retry budget.
 * Field violations are thrown synchronously as
 * {@link com.questrail.chat.protocol.codec.FrameEncodeException}.
 *
 * <h2>Inbound</h2>
 * Decoded messages, malformed input and faults are published in arrival order
 * on {@link #events()}. A fault is published at most once and never after a
 * local {@link #disconnect()}.
 */
public interface ProtocolTransport
{
    /**
     * Open the underlying socket.
     *
     * @return completes when the transport is usable, exceptionally if it cannot be opened
     */
    CompletableFuture<Void> start();

    /**
     * Encode and transmit one command.
     */
    CompletableFuture<DeliveryOutcome> send(OutboundCommand command);

    default CompletableFuture<DeliveryOutcome> sendAuthenticate(String username, String displayName, String secret) {
        return send(new OutboundCommand.Authenticate(username, displayName, secret));
    }

    default CompletableFuture<DeliveryOutcome> sendJoin(String channel, String displayName) {
        return send(new OutboundCommand.Join(channel, displayName));
    }

    default CompletableFuture<DeliveryOutcome> sendChatMessage(String displayName, String content) {
        return send(new OutboundCommand.ChatMessage(displayName, content));
    }

    default CompletableFuture<DeliveryOutcome> sendFarewell(String displayName) {
        return send(new OutboundCommand.Farewell(displayName));
    }

    default CompletableFuture<DeliveryOutcome> sendError(String displayName, String content) {
        return send(new OutboundCommand.ErrorReport(displayName, content));
    }

    /**
     * Completes once everything sent so far has left the transport
     * (stream: last write flushed; datagram: no acknowledgment outstanding).
     * Unbounded; callers apply their own timeout.
     */
    CompletableFuture<Void> flush();

    /**
     * Close the transport. Pending sends complete as {@code ABORTED}.
     * Idempotent.
     */
    CompletableFuture<Void> disconnect();

    /**
     * Inbound event stream.
     */
    BlockingQueue<TransportEvent> events();
}
