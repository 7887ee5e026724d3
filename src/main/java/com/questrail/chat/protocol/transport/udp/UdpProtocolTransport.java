package com.questrail.chat.protocol.transport.udp;

import com.questrail.chat.protocol.codec.DatagramDecodeException;
import com.questrail.chat.protocol.codec.DatagramFrameCodec;
import com.questrail.chat.protocol.codec.InboundDecodeResult;
import com.questrail.chat.protocol.internal.frame.DatagramFrame;
import com.questrail.chat.protocol.internal.reliability.InboundDisposition;
import com.questrail.chat.protocol.internal.reliability.ReliabilityEngine;
import com.questrail.chat.protocol.model.DeliveryOutcome;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.observability.ChatTransportEvent;
import com.questrail.chat.protocol.transport.DatagramEndpoint;
import com.questrail.chat.protocol.transport.DatagramEndpointListener;
import com.questrail.chat.protocol.transport.ProtocolTransport;
import com.questrail.chat.protocol.transport.TransportEvent;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * UdpProtocolTransport
 * =============================================================================
 * Datagram binding of {@link ProtocolTransport}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → DatagramFrameCodec.decode        (malformed bytes → Malformed event)
 *            → ReliabilityEngine.onInbound  (acknowledge, rebind, deduplicate)
 *                → DatagramFrameCodec.normalize
 *                    → events()
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   OutboundCommand → ReliabilityEngine.send(id → DatagramFrameCodec.encode) → DatagramEndpoint
 * </pre>
 *
 * <p>This class adds no retry or timing logic of its own; both belong to the
 * {@link ReliabilityEngine}.</p>
 */
public final class UdpProtocolTransport implements ProtocolTransport, DatagramEndpointListener
{
    private final DatagramEndpoint endpoint;
    private final DatagramFrameCodec codec;
    private final ReliabilityEngine reliability;
    private final ChatObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private final BlockingQueue<TransportEvent> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> started = new CompletableFuture<>();
    private final AtomicBoolean faultPublished = new AtomicBoolean(false);
    private final AtomicBoolean disconnecting = new AtomicBoolean(false);
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();

    public UdpProtocolTransport(DatagramEndpoint endpoint,
                                DatagramFrameCodec codec,
                                ReliabilityEngine reliability,
                                ChatObservabilitySink observabilitySink,
                                Supplier<Instant> wallClock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.reliability = Objects.requireNonNull(reliability, "reliability");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    @Override
    public CompletableFuture<Void> start() {
        endpoint.start();
        return started;
    }

    @Override
    public CompletableFuture<DeliveryOutcome> send(OutboundCommand command) {
        Objects.requireNonNull(command, "command");
        if (disconnecting.get()) {
            return CompletableFuture.completedFuture(DeliveryOutcome.ABORTED);
        }
        return reliability.send(id -> codec.encode(command, id));
    }

    @Override
    public CompletableFuture<Void> flush() {
        return reliability.idle();
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        if (disconnecting.compareAndSet(false, true)) {
            reliability.abortAll();
            endpoint.stop().whenComplete((v, e) -> stopped.complete(null));
        }
        return stopped;
    }

    @Override
    public BlockingQueue<TransportEvent> events() {
        return events;
    }

    /**
     * Current destination of outbound datagrams.
     */
    public SocketAddress peerAddress() {
        return reliability.peerAddress();
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportEvent(ChatTransportEvent.Kind.UP, "datagram socket bound");
        started.complete(null);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (!started.isDone()) {
            started.completeExceptionally(cause != null ? cause
                    : new IllegalStateException("datagram socket closed before it was bound"));
            return;
        }
        if (disconnecting.get()) {
            transportEvent(ChatTransportEvent.Kind.DOWN, "datagram socket closed");
            return;
        }
        publishFault(cause == null ? "datagram socket closed" : "datagram socket failed: " + cause.getMessage(), cause);
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        if (disconnecting.get()) {
            return;
        }

        final DatagramFrame frame;
        try {
            frame = codec.decode(payload);
        } catch (DatagramDecodeException e) {
            codec.readHeader(payload).ifPresent(header -> reliability.onUndecodable(remote, header));
            events.offer(new TransportEvent.Malformed(e.getMessage(), hex(payload)));
            return;
        }

        if (reliability.onInbound(remote, frame) != InboundDisposition.PROCESS) {
            return;
        }

        InboundDecodeResult result = codec.normalize(frame);
        if (result instanceof InboundDecodeResult.Decoded d) {
            events.offer(new TransportEvent.Received(d.message()));
        } else if (result instanceof InboundDecodeResult.Malformed m) {
            events.offer(new TransportEvent.Malformed(m.reason(), m.raw()));
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void publishFault(String description, Throwable cause) {
        if (faultPublished.compareAndSet(false, true)) {
            transportEvent(ChatTransportEvent.Kind.FAULT, description);
            events.offer(new TransportEvent.Fault(description, cause));
        }
    }

    private void transportEvent(ChatTransportEvent.Kind kind, String detail) {
        observabilitySink.onTransportEvent(new ChatTransportEvent(wallClock.get(), kind, detail));
    }

    private static String hex(byte[] payload) {
        StringBuilder sb = new StringBuilder();
        int limit = Math.min(payload.length, 32);
        for (int i = 0; i < limit; i++) {
            sb.append(String.format("%02X", payload[i] & 0xFF));
        }
        if (payload.length > limit) {
            sb.append("...");
        }
        return sb.toString();
    }
}
