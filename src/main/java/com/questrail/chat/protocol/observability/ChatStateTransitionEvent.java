package com.questrail.chat.protocol.observability;

import com.questrail.chat.protocol.internal.events.SessionEvent;
import com.questrail.chat.protocol.internal.state.SessionIntents;
import com.questrail.chat.protocol.internal.state.SessionState;

import java.time.Duration;
import java.time.Instant;

/**
 * One step of the session controller: the event applied, the states on
 * either side of it and the intents it produced.
 */
public record ChatStateTransitionEvent(
    Instant timestamp,
    SessionState oldState,
    SessionState newState,
    SessionEvent triggeringEvent,
    SessionIntents resultingIntents
) {
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }

    /** Time the session spent in {@code oldState} before this step. */
    public Duration sinceLastTransition() {
        return Duration.between(oldState.lastTransition(), newState.lastTransition());
    }

    public boolean isChannelChange() {
        return !oldState.confirmedChannel().equals(newState.confirmedChannel());
    }
}
