package com.questrail.chat.protocol.internal.reliability;

import com.questrail.chat.protocol.codec.DatagramFrameCodec;
import com.questrail.chat.protocol.internal.exec.ChatTimingPolicy;
import com.questrail.chat.protocol.internal.frame.DatagramFrame;
import com.questrail.chat.protocol.internal.frame.DatagramFrameType;
import com.questrail.chat.protocol.internal.frame.DatagramHeader;
import com.questrail.chat.protocol.internal.state.SessionView;
import com.questrail.chat.protocol.internal.time.MonotonicClock;
import com.questrail.chat.protocol.internal.time.MonotonicScheduler;
import com.questrail.chat.protocol.model.DeliveryOutcome;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.observability.ChatProtocolEvent;
import com.questrail.chat.protocol.transport.DatagramEndpoint;

import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * ReliabilityEngine
 * =============================================================================
 * Acknowledgment, retransmission, deduplication and peer address learning for
 * the datagram transport.
 *
 * <h2>Outbound</h2>
 * {@link #send(IntFunction)} allocates the next identifier, transmits, and
 * waits {@code confirmationTimeout} for a CONFIRM carrying that identifier.
 * Each expiry retransmits the identical bytes until {@code maxRetransmissions}
 * is spent; after the last wait the frame is transmitted once more without
 * waiting and the send completes as {@link DeliveryOutcome#UNCONFIRMED}.
 *
 * <h2>Inbound</h2>
 * {@link #onInbound(SocketAddress, DatagramFrame)} acknowledges every frame
 * except CONFIRM, to the frame's source address, even when the identifier was
 * already seen. Seen identifiers are reported as {@link InboundDisposition#DUPLICATE},
 * except a REPLY while a request is outstanding.
 *
 * <h2>Threading</h2>
 * Called from the send path, the endpoint's receive thread and the scheduler.
 * All mutable state is guarded by one lock. Futures are completed outside it.
 */
public final class ReliabilityEngine
{
    private final DatagramEndpoint endpoint;
    private final DatagramFrameCodec codec;
    private final SessionView session;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Duration confirmationTimeout;
    private final int maxRetransmissions;
    private final ChatObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private final Object lock = new Object();
    private final MessageIdAllocator ids = new MessageIdAllocator();
    private final SeenIdentifiers seen = new SeenIdentifiers();
    private final PeerAddressBinding peer;
    private final Map<Integer, PendingAck> pendingAcks = new HashMap<>();
    private final List<CompletableFuture<Void>> idleWaiters = new ArrayList<>();
    private boolean closed;

    public ReliabilityEngine(DatagramEndpoint endpoint,
                             DatagramFrameCodec codec,
                             SocketAddress serverAddress,
                             SessionView session,
                             MonotonicClock clock,
                             MonotonicScheduler scheduler,
                             ChatTimingPolicy timingPolicy,
                             ChatObservabilitySink observabilitySink,
                             Supplier<Instant> wallClock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.peer = new PeerAddressBinding(Objects.requireNonNull(serverAddress, "serverAddress"));
        this.session = Objects.requireNonNull(session, "session");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.confirmationTimeout = Objects.requireNonNull(timingPolicy, "timingPolicy").confirmationTimeout();
        this.maxRetransmissions = timingPolicy.maxRetransmissions();
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Send one application frame with acknowledgment tracking.
     *
     * @param encoder renders the frame for the identifier it is given; may throw
     *                {@link com.questrail.chat.protocol.codec.FrameEncodeException},
     *                in which case no identifier is consumed and nothing is sent
     * @return completes with {@code DELIVERED}, {@code UNCONFIRMED} or {@code ABORTED}
     */
    public CompletableFuture<DeliveryOutcome> send(IntFunction<byte[]> encoder) {
        Objects.requireNonNull(encoder, "encoder");

        synchronized (lock) {
            if (closed) {
                return CompletableFuture.completedFuture(DeliveryOutcome.ABORTED);
            }

            byte[] payload = encoder.apply(ids.peek());
            int id = ids.next();

            PendingAck pending = new PendingAck(id, payload, new CompletableFuture<>());
            pendingAcks.put(id, pending);

            transmit(pending.payload());
            protocolEvent(ChatProtocolEvent.Kind.FRAME_SENT, id, describe(payload) + " to " + peer.current());
            arm(pending);

            return pending.completion();
        }
    }

    private void arm(PendingAck pending) {
        pending.arm(scheduler.scheduleAfter(confirmationTimeout, clock, () -> onConfirmationTimeout(pending)));
    }

    private void onConfirmationTimeout(PendingAck pending) {
        List<CompletableFuture<Void>> idle;

        synchronized (lock) {
            // Stale: confirmed or aborted after this task was scheduled.
            if (closed || pendingAcks.get(pending.messageId()) != pending) {
                return;
            }

            if (pending.retransmissions() < maxRetransmissions) {
                pending.recordRetransmission();
                transmit(pending.payload());
                protocolEvent(ChatProtocolEvent.Kind.RETRANSMISSION, pending.messageId(),
                        "attempt " + (pending.retransmissions() + 1) + " of " + (maxRetransmissions + 1));
                arm(pending);
                return;
            }

            pendingAcks.remove(pending.messageId());
            transmit(pending.payload());
            protocolEvent(ChatProtocolEvent.Kind.UNCONFIRMED_DELIVERY, pending.messageId(),
                    "no acknowledgment after " + (maxRetransmissions + 1) + " attempts; sent once more unacknowledged");
            idle = takeIdleWaitersIfIdle();
        }

        pending.completion().complete(DeliveryOutcome.UNCONFIRMED);
        completeAll(idle);
    }

    private void transmit(byte[] payload) {
        endpoint.send(peer.current(), payload);
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Account for one decoded inbound datagram.
     */
    public InboundDisposition onInbound(SocketAddress source, DatagramFrame frame) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(frame, "frame");

        PendingAck confirmed = null;
        List<CompletableFuture<Void>> idle = List.of();
        InboundDisposition disposition;

        synchronized (lock) {
            if (peer.observe(source, session.isAuthenticated())) {
                protocolEvent(ChatProtocolEvent.Kind.PEER_REBOUND, -1, "sending to " + source);
            }

            if (frame.type().isAcknowledgment()) {
                confirmed = pendingAcks.remove(frame.messageId());
                if (confirmed != null) {
                    confirmed.disarm();
                    protocolEvent(ChatProtocolEvent.Kind.ACKNOWLEDGED, frame.messageId(), "from " + source);
                    idle = takeIdleWaitersIfIdle();
                }
                disposition = InboundDisposition.CONTROL;
            }
            else {
                protocolEvent(ChatProtocolEvent.Kind.FRAME_RECEIVED, frame.messageId(), frame.type() + " from " + source);
                endpoint.send(source, codec.encode(DatagramFrame.confirm(frame.messageId())));
                disposition = classify(frame);
            }
        }

        if (confirmed != null) {
            confirmed.completion().complete(DeliveryOutcome.DELIVERED);
        }
        completeAll(idle);
        return disposition;
    }

    /**
     * Account for a datagram whose header is readable but whose body failed to
     * parse. The source still counts for peer learning and the identifier is
     * still acknowledged; the identifier is not recorded as seen.
     */
    public void onUndecodable(SocketAddress source, DatagramHeader header) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(header, "header");

        synchronized (lock) {
            if (peer.observe(source, session.isAuthenticated())) {
                protocolEvent(ChatProtocolEvent.Kind.PEER_REBOUND, -1, "sending to " + source);
            }
            if (!header.type().isAcknowledgment()) {
                endpoint.send(source, codec.encode(DatagramFrame.confirm(header.messageId())));
            }
        }
    }

    private InboundDisposition classify(DatagramFrame frame) {
        if (frame.type() == DatagramFrameType.PING) {
            return InboundDisposition.CONTROL;
        }

        boolean fresh = seen.add(frame.messageId());
        if (fresh) {
            return InboundDisposition.PROCESS;
        }

        // A Reply is interpreted against session context, not identifier novelty.
        if (frame.type() == DatagramFrameType.REPLY && session.hasPendingRequest()) {
            return InboundDisposition.PROCESS;
        }

        protocolEvent(ChatProtocolEvent.Kind.DUPLICATE_SUPPRESSED, frame.messageId(), frame.type().toString());
        return InboundDisposition.DUPLICATE;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Completes once no acknowledgment is outstanding.
     */
    public CompletableFuture<Void> idle() {
        synchronized (lock) {
            if (pendingAcks.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            idleWaiters.add(waiter);
            return waiter;
        }
    }

    /**
     * Stop all retry loops. Outstanding sends complete as {@code ABORTED}; later
     * sends complete as {@code ABORTED} immediately. Idempotent.
     */
    public void abortAll() {
        List<PendingAck> aborted;
        List<CompletableFuture<Void>> idle;

        synchronized (lock) {
            closed = true;
            aborted = new ArrayList<>(pendingAcks.values());
            pendingAcks.clear();
            for (PendingAck p : aborted) {
                p.disarm();
            }
            idle = new ArrayList<>(idleWaiters);
            idleWaiters.clear();
        }

        for (PendingAck p : aborted) {
            p.completion().complete(DeliveryOutcome.ABORTED);
        }
        completeAll(idle);
    }

    public SocketAddress peerAddress() {
        synchronized (lock) {
            return peer.current();
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pendingAcks.size();
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private List<CompletableFuture<Void>> takeIdleWaitersIfIdle() {
        if (!pendingAcks.isEmpty() || idleWaiters.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Void>> waiters = new ArrayList<>(idleWaiters);
        idleWaiters.clear();
        return waiters;
    }

    private static void completeAll(List<CompletableFuture<Void>> waiters) {
        for (CompletableFuture<Void> w : waiters) {
            w.complete(null);
        }
    }

    private void protocolEvent(ChatProtocolEvent.Kind kind, int messageId, String detail) {
        observabilitySink.onProtocolEvent(new ChatProtocolEvent(wallClock.get(), kind, messageId, detail));
    }

    private static String describe(byte[] payload) {
        return DatagramFrameType.fromCode(payload[0])
                .map(Enum::name)
                .orElse("frame");
    }
}
