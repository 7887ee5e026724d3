package com.questrail.chat.protocol.runtime;

import com.questrail.chat.api.RecordingSessionOutput;
import com.questrail.chat.api.SessionPhase;
import com.questrail.chat.protocol.codec.impl.DefaultDatagramFrameCodec;
import com.questrail.chat.protocol.config.ChatClientConfig;
import com.questrail.chat.protocol.config.TransportKind;
import com.questrail.chat.protocol.internal.exec.ChatTimingPolicy;
import com.questrail.chat.protocol.internal.frame.DatagramFrame;
import com.questrail.chat.protocol.internal.frame.DatagramFrameType;
import com.questrail.chat.protocol.model.TerminationCause;
import com.questrail.chat.protocol.observability.RecordingObservabilitySink;
import com.questrail.chat.protocol.transport.FakeDatagramEndpoint;
import com.questrail.chat.protocol.transport.FakeStreamEndpoint;
import com.questrail.chat.protocol.transport.StreamEndpoint;
import com.questrail.chat.protocol.transport.StreamEndpointListener;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChatClientRuntimeTest
 * -----------------------------------------------------------------------------
 * The assembled client with real threads and timers, over fake endpoints.
 */
class ChatClientRuntimeTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final RecordingSessionOutput output = new RecordingSessionOutput();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private static ChatClientConfig config(TransportKind kind) {
        return ChatClientConfig.builder()
                .withHost("127.0.0.1")
                .withTransport(kind)
                .build();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + WAIT);
            }
            Thread.sleep(10);
        }
    }

    // ---------------------------------------------------------------------
    // Stream transport
    // ---------------------------------------------------------------------

    @Test
    void streamSessionRunsToUserRequestedEnd() throws Exception {
        FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
        ChatClientRuntime client = ChatClientRuntime.builder()
                .withConfig(config(TransportKind.TCP))
                .withSessionOutput(output)
                .withObservabilitySink(sink)
                .withStreamEndpoint(endpoint)
                .build();

        client.start();
        client.authenticate("bob", "secret", "Bob");
        assertEquals(SessionPhase.AUTHENTICATING, client.phase());

        endpoint.injectLine("REPLY OK IS Welcome");
        await(() -> client.phase() == SessionPhase.OPEN);
        assertEquals(Optional.of("default"), client.channel());
        assertEquals(Optional.of("Bob"), client.displayName());

        endpoint.injectLine("MSG FROM Alice IS hi");
        await(() -> output.lines().contains("chat Alice: hi"));

        client.stop();

        assertEquals(Optional.of(TerminationCause.USER_REQUEST), client.awaitTermination(Duration.ZERO));
        assertEquals("BYE FROM Bob\r\n", endpoint.written().get(endpoint.written().size() - 1));
        assertTrue(endpoint.isClosed());
        assertEquals(List.of(TerminationCause.USER_REQUEST), output.terminations());
    }

    @Test
    void serverClosingTheConnectionEndsTheSession() throws Exception {
        FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
        ChatClientRuntime client = ChatClientRuntime.builder()
                .withConfig(config(TransportKind.TCP))
                .withSessionOutput(output)
                .withObservabilitySink(sink)
                .withStreamEndpoint(endpoint)
                .build();
        client.start();

        endpoint.remoteClose();

        assertEquals(Optional.of(TerminationCause.CONNECTION_FAULT), client.awaitTermination(WAIT));
        assertEquals(SessionPhase.TERMINATED, client.phase());
    }

    @Test
    void refusedConnectionFailsStart() {
        StreamEndpoint refusing = new StreamEndpoint() {
            private StreamEndpointListener listener;

            @Override
            public void setListener(StreamEndpointListener listener) {
                this.listener = listener;
            }

            @Override
            public void connect() {
                listener.onDisconnected(new ConnectException("Connection refused"));
            }

            @Override
            public CompletableFuture<Void> send(String text) {
                return CompletableFuture.failedFuture(new IllegalStateException("not connected"));
            }

            @Override
            public CompletableFuture<Void> close() {
                return CompletableFuture.completedFuture(null);
            }
        };
        ChatClientRuntime client = ChatClientRuntime.builder()
                .withConfig(config(TransportKind.TCP))
                .withSessionOutput(output)
                .withObservabilitySink(sink)
                .withStreamEndpoint(refusing)
                .build();

        ChatClientStartException e = assertThrows(ChatClientStartException.class, client::start);
        assertTrue(e.getMessage().contains("Connection refused"));
        assertInstanceOf(ConnectException.class, e.getCause());
    }

    @Test
    void silentConnectFailsStartAfterTimeout() {
        StreamEndpoint silent = new StreamEndpoint() {
            @Override
            public void setListener(StreamEndpointListener listener) {
            }

            @Override
            public void connect() {
            }

            @Override
            public CompletableFuture<Void> send(String text) {
                return new CompletableFuture<>();
            }

            @Override
            public CompletableFuture<Void> close() {
                return CompletableFuture.completedFuture(null);
            }
        };
        ChatTimingPolicy d = ChatTimingPolicy.defaults();
        ChatTimingPolicy quick = new ChatTimingPolicy(d.confirmationTimeout(), d.maxRetransmissions(),
                d.authReplyTimeout(), d.joinReplyTimeout(), Duration.ofMillis(50),
                d.farewellTimeout(), d.flushTimeout(), d.disconnectTimeout());
        ChatClientRuntime client = ChatClientRuntime.builder()
                .withConfig(ChatClientConfig.builder().withHost("127.0.0.1").withTimingPolicy(quick).build())
                .withSessionOutput(output)
                .withObservabilitySink(sink)
                .withStreamEndpoint(silent)
                .build();

        ChatClientStartException e = assertThrows(ChatClientStartException.class, client::start);
        assertTrue(e.getMessage().contains("within 50 ms"));
    }

    // ---------------------------------------------------------------------
    // Datagram transport
    // ---------------------------------------------------------------------

    @Test
    void datagramSessionEndsOnServerFarewell() throws Exception {
        FakeDatagramEndpoint endpoint = new FakeDatagramEndpoint();
        DefaultDatagramFrameCodec codec = new DefaultDatagramFrameCodec();
        InetSocketAddress server = new InetSocketAddress("127.0.0.1", ChatClientConfig.DEFAULT_PORT);
        ChatClientRuntime client = ChatClientRuntime.builder()
                .withConfig(config(TransportKind.UDP))
                .withSessionOutput(output)
                .withObservabilitySink(sink)
                .withDatagramEndpoint(endpoint)
                .build();
        client.start();
        assertTrue(endpoint.isStarted());

        client.authenticate("bob", "secret", "Bob");
        endpoint.injectDatagram(server, codec.encode(DatagramFrame.confirm(0)));
        endpoint.injectDatagram(server, codec.encode(DatagramFrame.reply(0, true, 0, "Welcome")));
        await(() -> client.phase() == SessionPhase.OPEN);

        endpoint.injectDatagram(server, codec.encode(DatagramFrame.of(DatagramFrameType.BYE, 1, "Server")));

        assertEquals(Optional.of(TerminationCause.REMOTE_FAREWELL), client.awaitTermination(WAIT));
        assertTrue(endpoint.isStopped());
    }
}
