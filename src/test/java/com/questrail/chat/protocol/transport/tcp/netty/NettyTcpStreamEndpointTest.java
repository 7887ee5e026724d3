package com.questrail.chat.protocol.transport.tcp.netty;

import com.questrail.chat.protocol.transport.StreamEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpStreamEndpointTest
 * -----------------------------------------------------------------------------
 * Line framing over a loopback connection to a plain JDK server socket.
 */
class NettyTcpStreamEndpointTest {

    /** Listener that queues everything it is told. */
    private static final class QueueingListener implements StreamEndpointListener {
        final CountDownLatch connected = new CountDownLatch(1);
        final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        final BlockingQueue<String> disconnects = new LinkedBlockingQueue<>();
        final BlockingQueue<String> discarded = new LinkedBlockingQueue<>();

        @Override
        public void onConnected() {
            connected.countDown();
        }

        @Override
        public void onDisconnected(Throwable cause) {
            disconnects.add(cause == null ? "clean" : "failed");
        }

        @Override
        public void onLine(String line) {
            lines.add(line);
        }

        @Override
        public void onDiscardedLine(String reason) {
            discarded.add(reason);
        }
    }

    private ServerSocket server;
    private NettyTcpStreamEndpoint endpoint;
    private final QueueingListener listener = new QueueingListener();

    @BeforeEach
    void setUp() throws Exception {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        server.setSoTimeout(5_000);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (endpoint != null) {
            endpoint.close().get(5, TimeUnit.SECONDS);
        }
        server.close();
    }

    private NettyTcpStreamEndpoint endpointTo(int port) {
        NettyTcpStreamEndpoint e = new NettyTcpStreamEndpoint(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), port), Duration.ofSeconds(5));
        e.setListener(listener);
        return e;
    }

    @Test
    void exchangesCrlfTerminatedLines() throws Exception {
        endpoint = endpointTo(server.getLocalPort());
        endpoint.connect();

        try (Socket peer = server.accept()) {
            assertTrue(listener.connected.await(5, TimeUnit.SECONDS));

            endpoint.send("AUTH bob AS Bob USING secret\r\n").get(5, TimeUnit.SECONDS);
            BufferedReader in = new BufferedReader(new InputStreamReader(peer.getInputStream(), StandardCharsets.US_ASCII));
            assertEquals("AUTH bob AS Bob USING secret", in.readLine());

            OutputStream out = peer.getOutputStream();
            out.write("REPLY OK IS Welcome\r\nMSG FROM Alice IS hi\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();

            assertEquals("REPLY OK IS Welcome", listener.lines.poll(5, TimeUnit.SECONDS));
            assertEquals("MSG FROM Alice IS hi", listener.lines.poll(5, TimeUnit.SECONDS));
        }

        assertEquals("clean", listener.disconnects.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void oversizeLineIsDiscardedAndReadingContinues() throws Exception {
        endpoint = endpointTo(server.getLocalPort());
        endpoint.connect();

        try (Socket peer = server.accept()) {
            assertTrue(listener.connected.await(5, TimeUnit.SECONDS));

            OutputStream out = peer.getOutputStream();
            out.write("MSG FROM Alice IS ".getBytes(StandardCharsets.US_ASCII));
            out.write("x".repeat(NettyTcpStreamEndpoint.MAX_LINE_LENGTH + 100).getBytes(StandardCharsets.US_ASCII));
            out.write("\r\nMSG FROM Alice IS short\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();

            assertEquals("MSG FROM Alice IS short", listener.lines.poll(5, TimeUnit.SECONDS));
            assertEquals(1, listener.discarded.size());
            assertTrue(listener.lines.isEmpty());
            assertTrue(listener.disconnects.isEmpty());
        }

        assertEquals("clean", listener.disconnects.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void refusedConnectionIsReportedWithCause() throws Exception {
        int port = server.getLocalPort();
        server.close();

        endpoint = endpointTo(port);
        endpoint.connect();

        assertEquals("failed", listener.disconnects.poll(5, TimeUnit.SECONDS));
        assertEquals(1, listener.connected.getCount());
    }

    @Test
    void sendBeforeConnectFails() {
        endpoint = endpointTo(server.getLocalPort());

        assertTrue(endpoint.send("JOIN general AS Bob\r\n").isCompletedExceptionally());
    }
}
