package com.questrail.chat.protocol.transport.udp;

import com.questrail.chat.protocol.codec.impl.DefaultDatagramFrameCodec;
import com.questrail.chat.protocol.internal.exec.ChatTimingPolicy;
import com.questrail.chat.protocol.internal.frame.DatagramFrame;
import com.questrail.chat.protocol.internal.frame.DatagramFrameType;
import com.questrail.chat.protocol.internal.reliability.ReliabilityEngine;
import com.questrail.chat.protocol.internal.state.StubSessionView;
import com.questrail.chat.protocol.model.DeliveryOutcome;
import com.questrail.chat.protocol.model.NormalizedMessage;
import com.questrail.chat.protocol.observability.ChatTransportEvent;
import com.questrail.chat.protocol.observability.RecordingObservabilitySink;
import com.questrail.chat.protocol.time.DeterministicScheduler;
import com.questrail.chat.protocol.time.ManualMonotonicClock;
import com.questrail.chat.protocol.transport.FakeDatagramEndpoint;
import com.questrail.chat.protocol.transport.TransportEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UdpProtocolTransportTest
 * -----------------------------------------------------------------------------
 * The datagram binding over a {@link FakeDatagramEndpoint}: decode, reliability
 * and normalization on the way in, framing on the way out.
 */
class UdpProtocolTransportTest {

    private static final SocketAddress SERVER = new InetSocketAddress("127.0.0.1", 4567);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeDatagramEndpoint endpoint;
    private DefaultDatagramFrameCodec codec;
    private RecordingObservabilitySink sink;
    private UdpProtocolTransport transport;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        endpoint = new FakeDatagramEndpoint();
        codec = new DefaultDatagramFrameCodec();
        sink = new RecordingObservabilitySink();
        ReliabilityEngine reliability = new ReliabilityEngine(endpoint, codec, SERVER, new StubSessionView(),
                clock, scheduler, ChatTimingPolicy.defaults(), sink, Instant::now);
        transport = new UdpProtocolTransport(endpoint, codec, reliability, sink, Instant::now);
        transport.start().join();
    }

    private void inject(DatagramFrame frame) {
        endpoint.injectDatagram(SERVER, codec.encode(frame));
    }

    @Test
    void upwardContractEncodesEachOperation() {
        transport.sendAuthenticate("bob", "Bob", "secret");
        transport.sendJoin("general", "Bob");
        transport.sendChatMessage("Bob", "hi");
        transport.sendFarewell("Bob");
        transport.sendError("Bob", "bad");

        assertEquals(DatagramFrameType.AUTH, codec.decode(endpoint.sent().get(0).payload()).type());
        assertEquals(DatagramFrameType.JOIN, codec.decode(endpoint.sent().get(1).payload()).type());
        assertEquals(DatagramFrameType.MSG, codec.decode(endpoint.sent().get(2).payload()).type());
        assertEquals(DatagramFrameType.BYE, codec.decode(endpoint.sent().get(3).payload()).type());
        assertEquals(DatagramFrameType.ERR, codec.decode(endpoint.sent().get(4).payload()).type());
    }

    @Test
    void confirmedSendCompletesDelivered() {
        CompletableFuture<DeliveryOutcome> f = transport.sendChatMessage("Bob", "hi");

        inject(DatagramFrame.confirm(0));

        assertEquals(DeliveryOutcome.DELIVERED, f.join());
    }

    @Test
    void inboundChatIsNormalizedOntoTheQueue() {
        inject(DatagramFrame.of(DatagramFrameType.MSG, 3, "Alice", "hello"));

        assertEquals(new TransportEvent.Received(NormalizedMessage.chat("Alice", "hello")),
                transport.events().poll());
    }

    @Test
    void duplicatesReachTheQueueOnce() {
        DatagramFrame chat = DatagramFrame.of(DatagramFrameType.MSG, 3, "Alice", "hello");
        inject(chat);
        inject(chat);

        assertEquals(1, transport.events().size());
        assertEquals(2, endpoint.sent().size());
    }

    @Test
    void undecodableBytesBecomeMalformed() {
        endpoint.injectDatagram(SERVER, new byte[]{0x42, 0x00, 0x00});

        TransportEvent.Malformed m = assertInstanceOf(TransportEvent.Malformed.class, transport.events().poll());
        assertEquals("unknown frame type 0x42", m.reason());
        assertEquals("420000", m.raw());
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void invalidFieldInValidFrameIsAcknowledgedThenMalformed() {
        inject(DatagramFrame.of(DatagramFrameType.MSG, 8, "Al ice", "hello"));

        assertInstanceOf(TransportEvent.Malformed.class, transport.events().poll());
        assertEquals(1, endpoint.sent().size());
    }

    @Test
    void truncatedFrameFromNewPortStillRebindsAndIsAcknowledged() {
        SocketAddress dynamicPort = new InetSocketAddress("127.0.0.1", 50000);

        // MSG id 7: display name terminated, content unterminated
        endpoint.injectDatagram(dynamicPort, new byte[]{0x04, 0x07, 0x00, 'A', 0x00, 'h', 'i'});

        assertEquals(dynamicPort, transport.peerAddress());
        assertEquals(1, endpoint.sent().size());
        FakeDatagramEndpoint.Sent ack = endpoint.sent().get(0);
        assertEquals(dynamicPort, ack.remote());
        assertEquals(DatagramFrame.confirm(7), codec.decode(ack.payload()));
        assertInstanceOf(TransportEvent.Malformed.class, transport.events().poll());

        transport.sendError("Bob", "bad");

        assertEquals(dynamicPort, endpoint.sent().get(1).remote());
    }

    @Test
    void undecodableConfirmIsNotAcknowledged() {
        // CONFIRM carries no fields, so a trailing byte cannot parse
        endpoint.injectDatagram(SERVER, new byte[]{0x00, 0x01, 0x00, 0x55});

        assertInstanceOf(TransportEvent.Malformed.class, transport.events().poll());
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void socketFailureIsPublishedOnce() {
        endpoint.fail(new IllegalStateException("port unreachable"));
        endpoint.fail(new IllegalStateException("again"));

        TransportEvent.Fault fault = assertInstanceOf(TransportEvent.Fault.class, transport.events().poll());
        assertTrue(fault.description().contains("port unreachable"));
        assertNull(transport.events().poll());
    }

    @Test
    void localDisconnectIsNotAFault() {
        CompletableFuture<DeliveryOutcome> pending = transport.sendChatMessage("Bob", "hi");

        transport.disconnect().join();

        assertEquals(DeliveryOutcome.ABORTED, pending.join());
        assertTrue(endpoint.isStopped());
        assertTrue(transport.events().isEmpty());
        assertEquals(1, sink.countTransportEvents(ChatTransportEvent.Kind.DOWN));
        assertEquals(DeliveryOutcome.ABORTED, transport.sendChatMessage("Bob", "late").join());
    }

    @Test
    void flushWaitsForOutstandingAcknowledgments() {
        transport.sendChatMessage("Bob", "hi");
        CompletableFuture<Void> flushed = transport.flush();
        assertFalse(flushed.isDone());

        inject(DatagramFrame.confirm(0));

        assertTrue(flushed.isDone());
    }
}
