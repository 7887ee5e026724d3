package com.questrail.chat.protocol.internal.shutdown;

import com.questrail.chat.api.RecordingSessionOutput;
import com.questrail.chat.protocol.internal.exec.ChatTimingPolicy;
import com.questrail.chat.protocol.model.DeliveryOutcome;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.model.TerminationCause;
import com.questrail.chat.protocol.observability.ChatErrorEvent;
import com.questrail.chat.protocol.observability.RecordingObservabilitySink;
import com.questrail.chat.protocol.time.DeterministicScheduler;
import com.questrail.chat.protocol.time.ManualMonotonicClock;
import com.questrail.chat.protocol.transport.ProtocolTransport;
import com.questrail.chat.protocol.transport.TransportEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ShutdownCoordinatorTest
 * -----------------------------------------------------------------------------
 * Stage order, per-stage bounds, and idempotency of the termination sequence.
 */
class ShutdownCoordinatorTest {

    /** Transport whose futures are completed by the test. */
    private static final class ScriptedTransport implements ProtocolTransport {
        final List<String> calls = new ArrayList<>();
        CompletableFuture<DeliveryOutcome> sendResult = CompletableFuture.completedFuture(DeliveryOutcome.DELIVERED);
        CompletableFuture<Void> flushResult = CompletableFuture.completedFuture(null);
        CompletableFuture<Void> disconnectResult = CompletableFuture.completedFuture(null);

        @Override
        public CompletableFuture<Void> start() {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<DeliveryOutcome> send(OutboundCommand command) {
            calls.add("send " + command.getClass().getSimpleName());
            return sendResult;
        }

        @Override
        public CompletableFuture<Void> flush() {
            calls.add("flush");
            return flushResult;
        }

        @Override
        public CompletableFuture<Void> disconnect() {
            calls.add("disconnect");
            return disconnectResult;
        }

        @Override
        public BlockingQueue<TransportEvent> events() {
            return new LinkedBlockingQueue<>();
        }
    }

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private ScriptedTransport transport;
    private RecordingSessionOutput output;
    private RecordingObservabilitySink sink;
    private AtomicInteger afterCloseRuns;
    private ShutdownCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        transport = new ScriptedTransport();
        output = new RecordingSessionOutput();
        sink = new RecordingObservabilitySink();
        afterCloseRuns = new AtomicInteger();
        coordinator = new ShutdownCoordinator(transport, output, clock, scheduler,
                ChatTimingPolicy.defaults(), sink, Instant::now, afterCloseRuns::incrementAndGet);
    }

    @Test
    void runsNoticeFlushDisconnectInOrder() {
        CompletableFuture<TerminationCause> done = coordinator.shutdown(
                TerminationCause.USER_REQUEST, Optional.of(new OutboundCommand.Farewell("Bob")));

        assertEquals(List.of("send Farewell", "flush", "disconnect"), transport.calls);
        assertEquals(TerminationCause.USER_REQUEST, done.join());
        assertEquals(List.of(TerminationCause.USER_REQUEST), output.terminations());
        assertEquals(1, afterCloseRuns.get());
    }

    @Test
    void withoutNoticeNothingIsSent() {
        coordinator.shutdown(TerminationCause.REMOTE_FAREWELL, Optional.empty());

        assertEquals(List.of("flush", "disconnect"), transport.calls);
    }

    @Test
    void eachStageIsBoundedByItsTimeout() {
        transport.sendResult = new CompletableFuture<>();
        transport.flushResult = new CompletableFuture<>();
        transport.disconnectResult = new CompletableFuture<>();

        CompletableFuture<TerminationCause> done = coordinator.shutdown(
                TerminationCause.USER_REQUEST, Optional.of(new OutboundCommand.Farewell("Bob")));

        scheduler.advanceMillis(999);
        assertEquals(List.of("send Farewell"), transport.calls);

        scheduler.advanceMillis(1);
        assertEquals(List.of("send Farewell", "flush"), transport.calls);

        scheduler.advanceMillis(500);
        assertEquals(List.of("send Farewell", "flush", "disconnect"), transport.calls);
        assertFalse(done.isDone());

        scheduler.advanceMillis(1_000);
        assertTrue(done.isDone());
        assertEquals(3, sink.getAllEvents().stream().filter(e -> e instanceof ChatErrorEvent).count());
    }

    @Test
    void failingStageDoesNotStopTheSequence() {
        transport.flushResult = CompletableFuture.failedFuture(new IllegalStateException("socket gone"));

        CompletableFuture<TerminationCause> done = coordinator.shutdown(
                TerminationCause.CONNECTION_FAULT, Optional.empty());

        assertEquals(TerminationCause.CONNECTION_FAULT, done.join());
        assertTrue(transport.calls.contains("disconnect"));
        assertTrue(sink.hasEventOfType(ChatErrorEvent.class));
    }

    @Test
    void concurrentTriggersCollapseIntoOneSequence() {
        transport.disconnectResult = new CompletableFuture<>();

        CompletableFuture<TerminationCause> first = coordinator.shutdown(TerminationCause.REMOTE_ERROR, Optional.empty());
        CompletableFuture<TerminationCause> second = coordinator.shutdown(
                TerminationCause.USER_REQUEST, Optional.of(new OutboundCommand.Farewell("Bob")));

        assertSame(first, second);
        assertTrue(coordinator.isShuttingDown());

        transport.disconnectResult.complete(null);

        assertEquals(TerminationCause.REMOTE_ERROR, second.join());
        assertEquals(List.of("flush", "disconnect"), transport.calls);
        assertEquals(1, output.terminations().size());
        assertEquals(1, afterCloseRuns.get());
    }

    @Test
    void lateStageCompletionAfterTimeoutIsIgnored() {
        transport.sendResult = new CompletableFuture<>();

        coordinator.shutdown(TerminationCause.USER_REQUEST, Optional.of(new OutboundCommand.Farewell("Bob")));
        scheduler.advanceMillis(1_000);
        transport.sendResult.complete(DeliveryOutcome.UNCONFIRMED);

        assertEquals(List.of("send Farewell", "flush", "disconnect"), transport.calls);
        assertEquals(1, output.terminations().size());
    }
}
