package com.questrail.chat.protocol.observability;

import com.questrail.chat.protocol.internal.events.SessionTimeoutEvent;
import com.questrail.chat.protocol.internal.state.PendingRequest;
import com.questrail.chat.protocol.internal.state.SessionIntents;
import com.questrail.chat.protocol.internal.state.SessionState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChatStateTransitionEventTest
 * -----------------------------------------------------------------------------
 * Derived facts the logging sink reads off one controller step.
 */
class ChatStateTransitionEventTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static ChatStateTransitionEvent step(SessionState before, SessionState after) {
        return new ChatStateTransitionEvent(after.lastTransition(), before, after,
                new SessionTimeoutEvent.ReplyTimeout(after.lastTransition(), PendingRequest.AUTHENTICATION),
                SessionIntents.none());
    }

    @Test
    void dwellTimeIsMeasuredBetweenTransitionStamps() {
        SessionState init = SessionState.initial(T0);
        SessionState authenticating = init.authenticating("Bob", T0.plusMillis(150));
        SessionState open = authenticating.authenticatedInto("general", T0.plusMillis(400));

        assertEquals(Duration.ofMillis(150), step(init, authenticating).sinceLastTransition());
        assertEquals(Duration.ofMillis(250), step(authenticating, open).sinceLastTransition());
    }

    @Test
    void phaseAndChannelChangesAreDetected() {
        SessionState authenticating = SessionState.initial(T0).authenticating("Bob", T0);
        SessionState open = authenticating.authenticatedInto("general", T0.plusSeconds(1));

        ChatStateTransitionEvent event = step(authenticating, open);

        assertTrue(event.isPhaseChange());
        assertTrue(event.isChannelChange());
        assertFalse(step(open, open.withDisplayName("Robert", T0.plusSeconds(2))).isChannelChange());
    }
}
