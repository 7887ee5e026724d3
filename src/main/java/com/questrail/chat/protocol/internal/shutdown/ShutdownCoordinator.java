package com.questrail.chat.protocol.internal.shutdown;

import com.questrail.chat.api.SessionOutput;
import com.questrail.chat.protocol.codec.FrameEncodeException;
import com.questrail.chat.protocol.internal.exec.ChatTimingPolicy;
import com.questrail.chat.protocol.internal.time.Cancellable;
import com.questrail.chat.protocol.internal.time.MonotonicClock;
import com.questrail.chat.protocol.internal.time.MonotonicScheduler;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.model.TerminationCause;
import com.questrail.chat.protocol.observability.ChatErrorEvent;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.transport.ProtocolTransport;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * ShutdownCoordinator
 * =============================================================================
 * Runs the bounded termination sequence, whatever the active transport.
 *
 * <h2>Stages</h2>
 * <pre>
 *   1. notify peer   (farewell / error notice, if any)   ≤ farewellTimeout
 *   2. flush         (outstanding writes / acks)         ≤ flushTimeout
 *   3. disconnect    (close the transport)               ≤ disconnectTimeout
 *   4. afterClose hook, then SessionOutput.onTerminated(cause)
 * </pre>
 *
 * <p>Each stage moves on when its future completes, fails, or its bound expires
 * on the {@link MonotonicScheduler}, whichever comes first. A stage failure is
 * reported to observability and never stops the sequence.</p>
 *
 * <p>{@link #shutdown} is idempotent: concurrent triggers collapse into the first
 * sequence, and later callers receive the same termination future.</p>
 */
public final class ShutdownCoordinator
{
    private final ProtocolTransport transport;
    private final SessionOutput output;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ChatTimingPolicy timingPolicy;
    private final ChatObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;
    private final Runnable afterClose;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<TerminationCause> termination = new CompletableFuture<>();

    public ShutdownCoordinator(ProtocolTransport transport,
                               SessionOutput output,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler,
                               ChatTimingPolicy timingPolicy,
                               ChatObservabilitySink observabilitySink,
                               Supplier<Instant> wallClock,
                               Runnable afterClose)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.output = Objects.requireNonNull(output, "output");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.afterClose = Objects.requireNonNull(afterClose, "afterClose");
    }

    /**
     * Starts the sequence, or joins the one already running.
     *
     * @param notice frame to send to the peer before closing
     */
    public CompletableFuture<TerminationCause> shutdown(TerminationCause cause, Optional<OutboundCommand> notice) {
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(notice, "notice");

        if (!started.compareAndSet(false, true)) {
            return termination;
        }

        bounded("notify peer", () -> notice.map(this::sendNotice).orElseGet(() -> CompletableFuture.completedFuture(null)),
                timingPolicy.farewellTimeout())
                .thenCompose(v -> bounded("flush", transport::flush, timingPolicy.flushTimeout()))
                .thenCompose(v -> bounded("disconnect", transport::disconnect, timingPolicy.disconnectTimeout()))
                .whenComplete((v, e) -> finish(cause));

        return termination;
    }

    /**
     * Completes with the termination cause once the sequence has finished.
     */
    public CompletableFuture<TerminationCause> termination() {
        return termination;
    }

    public boolean isShuttingDown() {
        return started.get();
    }

    private CompletableFuture<?> sendNotice(OutboundCommand notice) {
        try {
            return transport.send(notice);
        } catch (FrameEncodeException e) {
            error("shutdown notice could not be encoded", e);
            return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> bounded(String stage, Supplier<CompletableFuture<?>> action, Duration bound) {
        CompletableFuture<Void> done = new CompletableFuture<>();

        CompletableFuture<?> work;
        try {
            work = action.get();
        } catch (RuntimeException e) {
            error("shutdown stage '" + stage + "' failed", e);
            done.complete(null);
            return done;
        }

        Cancellable timer = scheduler.scheduleAfter(bound, clock, () -> {
            if (done.complete(null)) {
                error("shutdown stage '" + stage + "' did not finish within " + bound.toMillis() + " ms", null);
            }
        });

        work.whenComplete((v, e) -> {
            timer.cancel();
            if (e != null) {
                error("shutdown stage '" + stage + "' failed", e);
            }
            done.complete(null);
        });
        return done;
    }

    private void finish(TerminationCause cause) {
        try {
            afterClose.run();
        } catch (RuntimeException e) {
            error("post-shutdown cleanup failed", e);
        }
        try {
            output.onTerminated(cause);
        } finally {
            termination.complete(cause);
        }
    }

    private void error(String message, Throwable cause) {
        observabilitySink.onError(new ChatErrorEvent(wallClock.get(), message, cause));
    }
}
