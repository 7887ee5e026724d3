package com.questrail.chat.protocol;

import com.questrail.chat.protocol.internal.events.SessionEvent;
import com.questrail.chat.protocol.internal.exec.SessionIntentExecutor;
import com.questrail.chat.protocol.internal.state.SessionReducer;
import com.questrail.chat.protocol.internal.state.SessionState;
import com.questrail.chat.protocol.internal.state.SessionView;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.observability.ChatStateTransitionEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * ChatSessionController
 * -----------------------------------------------------------------------------
 * Owner of the one live {@link SessionState}.
 *
 * <h2>Execution model</h2>
 * <pre>
 *   event → reducer → new state → observability → intents → executor
 * </pre>
 *
 * <p>Two threads submit events: the caller issuing commands and the
 * inbound-receive task. {@link #submit} is the single mutual-exclusion boundary
 * around session mutation, so a Reply cannot interleave with a command being
 * reduced. Intents are executed inside that boundary to keep their order.</p>
 *
 * <p>Reads ({@link #state()} and the {@link SessionView} methods) do not take
 * the lock; they see the last published snapshot.</p>
 */
public final class ChatSessionController implements SessionView
{
    private final SessionReducer reducer;
    private final SessionIntentExecutor executor;
    private final ChatObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private final Object lock = new Object();
    private volatile SessionState state;

    public ChatSessionController(SessionState initialState,
                                 SessionReducer reducer,
                                 SessionIntentExecutor executor,
                                 ChatObservabilitySink observabilitySink,
                                 Supplier<Instant> wallClock)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Reduce one event and execute the resulting intents.
     */
    public void submit(SessionEvent event) {
        Objects.requireNonNull(event, "event");

        synchronized (lock) {
            SessionState before = state;
            SessionReducer.Result result = reducer.apply(before, event);
            state = result.newState();

            observabilitySink.onStateTransition(new ChatStateTransitionEvent(
                    wallClock.get(), before, result.newState(), event, result.intents()));

            executor.execute(result.intents());
        }
    }

    /**
     * Current immutable session snapshot.
     */
    public SessionState state() {
        return state;
    }

    @Override
    public boolean isAuthenticated() {
        return state.authenticated();
    }

    @Override
    public boolean hasPendingRequest() {
        return state.hasPendingRequest();
    }
}
