package com.questrail.chat.protocol.internal.exec;

import com.questrail.chat.protocol.internal.events.SessionEvent;
import com.questrail.chat.protocol.internal.events.SessionTimeoutEvent;
import com.questrail.chat.protocol.internal.state.PendingRequest;
import com.questrail.chat.protocol.internal.state.SessionIntent;
import com.questrail.chat.protocol.internal.state.SessionIntents;
import com.questrail.chat.protocol.internal.time.Cancellable;
import com.questrail.chat.protocol.internal.time.MonotonicClock;
import com.questrail.chat.protocol.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * TimedSessionIntentExecutor
 * =============================================================================
 * Wraps a {@link SessionIntentExecutor} and adds reply timeouts.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>After delegating a {@code SEND_AUTHENTICATE} or {@code SEND_JOIN}, arms a
 *       single reply timer ({@code authReplyTimeout} / {@code joinReplyTimeout}).</li>
 *   <li>{@code REPORT_REPLY} and {@code BEGIN_SHUTDOWN} cancel the armed timer.</li>
 *   <li>On expiry, injects {@link SessionTimeoutEvent.ReplyTimeout}. The reducer
 *       decides whether it still matters.</li>
 * </ul>
 *
 * <p>Timers carry a sequence number so a task that fires after being replaced
 * or cancelled does nothing.</p>
 */
public final class TimedSessionIntentExecutor implements SessionIntentExecutor
{
    private final SessionIntentExecutor delegate;
    private final Consumer<SessionEvent> eventSink;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Supplier<Instant> wallClock;
    private final ChatTimingPolicy timingPolicy;

    private final Object lock = new Object();
    private long armedSequence;
    private Cancellable armedTimeout;

    public TimedSessionIntentExecutor(SessionIntentExecutor delegate,
                                      Consumer<SessionEvent> eventSink,
                                      MonotonicClock clock,
                                      MonotonicScheduler scheduler,
                                      Supplier<Instant> wallClock,
                                      ChatTimingPolicy timingPolicy)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
    }

    @Override
    public void execute(SessionIntents intents) {
        Objects.requireNonNull(intents, "intents");

        if (intents.contains(SessionIntent.Kind.BEGIN_SHUTDOWN)
                || intents.contains(SessionIntent.Kind.REPORT_REPLY)) {
            cancelArmedTimeout();
        }

        delegate.execute(intents);

        if (intents.contains(SessionIntent.Kind.SEND_AUTHENTICATE)) {
            arm(PendingRequest.AUTHENTICATION, timingPolicy.authReplyTimeout());
        }
        else if (intents.contains(SessionIntent.Kind.SEND_JOIN)) {
            arm(PendingRequest.JOIN, timingPolicy.joinReplyTimeout());
        }
    }

    /**
     * Whether a reply timer is currently armed.
     */
    public boolean isArmed() {
        synchronized (lock) {
            return armedTimeout != null;
        }
    }

    private void arm(PendingRequest request, Duration timeout) {
        synchronized (lock) {
            disarmLocked();
            long seq = ++armedSequence;
            armedTimeout = scheduler.scheduleAfter(timeout, clock, () -> onReplyTimeout(seq, request));
        }
    }

    private void cancelArmedTimeout() {
        synchronized (lock) {
            disarmLocked();
            armedSequence++;
        }
    }

    private void disarmLocked() {
        if (armedTimeout != null) {
            armedTimeout.cancel();
            armedTimeout = null;
        }
    }

    private void onReplyTimeout(long seq, PendingRequest request) {
        synchronized (lock) {
            if (seq != armedSequence) {
                return;
            }
            armedTimeout = null;
        }
        eventSink.accept(new SessionTimeoutEvent.ReplyTimeout(wallClock.get(), request));
    }
}
