package com.questrail.chat.protocol.internal.exec;

import com.questrail.chat.protocol.internal.state.SessionIntents;

/**
 * Carries out the intents produced by the session reducer.
 *
 * <p>Executors never change session state; they only perform effects
 * (wire sends, user output, timers, shutdown).</p>
 */
public interface SessionIntentExecutor
{
    void execute(SessionIntents intents);
}
