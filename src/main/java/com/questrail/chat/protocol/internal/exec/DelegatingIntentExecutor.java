package com.questrail.chat.protocol.internal.exec;

import com.questrail.chat.protocol.internal.state.SessionIntents;

import java.util.Objects;

/**
 * Forwards to an executor installed after construction.
 *
 * <p>Breaks the construction cycle controller → executor → transport →
 * controller (the datagram transport reads session context).</p>
 */
public final class DelegatingIntentExecutor implements SessionIntentExecutor
{
    private volatile SessionIntentExecutor delegate;

    public void setDelegate(SessionIntentExecutor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void execute(SessionIntents intents) {
        SessionIntentExecutor d = delegate;
        if (d == null) {
            throw new IllegalStateException("delegate executor not installed");
        }
        d.execute(intents);
    }
}
