package com.questrail.chat.protocol.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint}: records written text, lets tests push
 * inbound lines and simulate the server closing the connection.
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    private StreamEndpointListener listener;
    private final List<String> written = new ArrayList<>();
    private volatile boolean connected;
    private volatile boolean closed;
    private volatile boolean failWrites;

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect() {
        connected = true;
        listener.onConnected();
    }

    @Override
    public synchronized CompletableFuture<Void> send(String text) {
        if (failWrites || closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("not connected"));
        }
        written.add(text);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> close() {
        if (!closed) {
            closed = true;
            listener.onDisconnected(null);
        }
        return CompletableFuture.completedFuture(null);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /** Delivers one line, without its terminator. */
    public void injectLine(String line) {
        listener.onLine(line);
    }

    /** Simulates a line the endpoint dropped, e.g. for exceeding the line limit. */
    public void discardLine(String reason) {
        listener.onDiscardedLine(reason);
    }

    /** Simulates the server closing the connection. */
    public void remoteClose() {
        listener.onDisconnected(null);
    }

    public void failWrites() {
        this.failWrites = true;
    }

    public synchronized List<String> written() {
        return Collections.unmodifiableList(new ArrayList<>(written));
    }

    public boolean isConnected() {
        return connected;
    }

    public boolean isClosed() {
        return closed;
    }
}
