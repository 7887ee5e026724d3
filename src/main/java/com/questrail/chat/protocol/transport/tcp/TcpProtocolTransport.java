package com.questrail.chat.protocol.transport.tcp;

import com.questrail.chat.protocol.codec.InboundDecodeResult;
import com.questrail.chat.protocol.codec.StreamFrameCodec;
import com.questrail.chat.protocol.model.DeliveryOutcome;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.observability.ChatProtocolEvent;
import com.questrail.chat.protocol.observability.ChatTransportEvent;
import com.questrail.chat.protocol.transport.ProtocolTransport;
import com.questrail.chat.protocol.transport.StreamEndpoint;
import com.questrail.chat.protocol.transport.StreamEndpointListener;
import com.questrail.chat.protocol.transport.TransportEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * TcpProtocolTransport
 * =============================================================================
 * Stream binding of {@link ProtocolTransport}.
 *
 * <p>The stream is reliable and ordered, so there is no acknowledgment layer:
 * a send is {@link DeliveryOutcome#DELIVERED} once its line is flushed to the
 * socket, {@link DeliveryOutcome#FAILED} if the write fails.</p>
 *
 * <p>A connection closed by the server is a fault, surfaced once.</p>
 */
public final class TcpProtocolTransport implements ProtocolTransport, StreamEndpointListener
{
    private final StreamEndpoint endpoint;
    private final StreamFrameCodec codec;
    private final ChatObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private final BlockingQueue<TransportEvent> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> started = new CompletableFuture<>();
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();
    private final AtomicBoolean faultPublished = new AtomicBoolean(false);
    private final AtomicBoolean disconnecting = new AtomicBoolean(false);

    private final Object writeLock = new Object();
    private CompletableFuture<Void> lastWrite = CompletableFuture.completedFuture(null);

    public TcpProtocolTransport(StreamEndpoint endpoint,
                                StreamFrameCodec codec,
                                ChatObservabilitySink observabilitySink,
                                Supplier<Instant> wallClock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    @Override
    public CompletableFuture<Void> start() {
        endpoint.connect();
        return started;
    }

    @Override
    public CompletableFuture<DeliveryOutcome> send(OutboundCommand command) {
        Objects.requireNonNull(command, "command");
        if (disconnecting.get()) {
            return CompletableFuture.completedFuture(DeliveryOutcome.ABORTED);
        }

        String line = codec.encode(command);
        CompletableFuture<Void> write;
        synchronized (writeLock) {
            write = endpoint.send(line);
            lastWrite = write;
        }
        observabilitySink.onProtocolEvent(new ChatProtocolEvent(wallClock.get(),
                ChatProtocolEvent.Kind.FRAME_SENT, -1, line.strip()));

        return write.handle((v, e) -> e == null ? DeliveryOutcome.DELIVERED : DeliveryOutcome.FAILED);
    }

    @Override
    public CompletableFuture<Void> flush() {
        CompletableFuture<Void> write;
        synchronized (writeLock) {
            write = lastWrite;
        }
        return write.handle((v, e) -> null);
    }

    @Override
    public CompletableFuture<Void> disconnect() {
        if (disconnecting.compareAndSet(false, true)) {
            endpoint.close().whenComplete((v, e) -> stopped.complete(null));
        }
        return stopped;
    }

    @Override
    public BlockingQueue<TransportEvent> events() {
        return events;
    }

    // -------------------------------------------------------------------------
    // StreamEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected() {
        observabilitySink.onTransportEvent(new ChatTransportEvent(wallClock.get(),
                ChatTransportEvent.Kind.UP, "connected"));
        started.complete(null);
    }

    @Override
    public void onDisconnected(Throwable cause) {
        if (!started.isDone()) {
            started.completeExceptionally(cause != null ? cause
                    : new IllegalStateException("connection closed before it was established"));
            return;
        }
        if (disconnecting.get()) {
            observabilitySink.onTransportEvent(new ChatTransportEvent(wallClock.get(),
                    ChatTransportEvent.Kind.DOWN, "connection closed"));
            return;
        }

        String description = cause == null
                ? "connection closed by server"
                : "connection failed: " + cause.getMessage();
        if (faultPublished.compareAndSet(false, true)) {
            observabilitySink.onTransportEvent(new ChatTransportEvent(wallClock.get(),
                    ChatTransportEvent.Kind.FAULT, description));
            events.offer(new TransportEvent.Fault(description, cause));
        }
    }

    @Override
    public void onLine(String line) {
        if (disconnecting.get()) {
            return;
        }
        observabilitySink.onProtocolEvent(new ChatProtocolEvent(wallClock.get(),
                ChatProtocolEvent.Kind.FRAME_RECEIVED, -1, line));

        InboundDecodeResult result = codec.decode(line);
        if (result instanceof InboundDecodeResult.Decoded d) {
            events.offer(new TransportEvent.Received(d.message()));
        } else if (result instanceof InboundDecodeResult.Malformed m) {
            events.offer(new TransportEvent.Malformed(m.reason(), m.raw()));
        }
    }

    @Override
    public void onDiscardedLine(String reason) {
        if (disconnecting.get()) {
            return;
        }
        events.offer(new TransportEvent.Malformed("line discarded: " + reason, ""));
    }
}
