package com.questrail.chat.protocol.internal.exec;

import com.questrail.chat.protocol.internal.events.SessionEvent;
import com.questrail.chat.protocol.internal.events.SessionMessageEvent;
import com.questrail.chat.protocol.internal.events.SessionTransportEvent;
import com.questrail.chat.protocol.observability.ChatErrorEvent;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.transport.TransportEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * SessionDriver
 * =============================================================================
 * The inbound-receive task: drains a transport's event queue, translates each
 * {@link TransportEvent} into a {@link SessionEvent} and submits it.
 *
 * <h2>Threading model</h2>
 * One dedicated thread, blocked on {@link BlockingQueue#take()}. The submit
 * target serializes against the command path, so this class holds no
 * session state itself.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()  → starts the receive thread
 *   driver.stop()   → interrupts it; does not wait
 * </pre>
 * {@link #stop()} may be called from the receive thread itself (shutdown
 * triggered by an inbound message), so it never joins.
 */
public final class SessionDriver
{
    private final BlockingQueue<TransportEvent> source;
    private final Consumer<SessionEvent> sink;
    private final ChatObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    public SessionDriver(BlockingQueue<TransportEvent> source,
                         Consumer<SessionEvent> sink,
                         ChatObservabilitySink observabilitySink,
                         Supplier<Instant> wallClock)
    {
        this.source = Objects.requireNonNull(source, "source");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "chat-session-driver");
            t.setDaemon(true);
            thread = t;
            t.start();
        }
    }

    /**
     * Idempotent.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = thread;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void run() {
        while (running.get()) {
            try {
                TransportEvent event = source.take();
                if (running.get()) {
                    sink.accept(translate(event));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                observabilitySink.onError(new ChatErrorEvent(wallClock.get(), "inbound event processing failed", e));
            }
        }
    }

    /**
     * Transport vocabulary to session vocabulary.
     */
    public SessionEvent translate(TransportEvent event) {
        Instant now = wallClock.get();
        if (event instanceof TransportEvent.Received r) {
            return new SessionMessageEvent.MessageReceived(now, r.message());
        }
        if (event instanceof TransportEvent.Malformed m) {
            return new SessionMessageEvent.MalformedReceived(now, m.reason());
        }
        TransportEvent.Fault f = (TransportEvent.Fault) event;
        return new SessionTransportEvent.ConnectionLost(now, f.description());
    }
}
