package com.questrail.chat.protocol.internal.state;

import com.questrail.chat.api.SessionPhase;
import com.questrail.chat.protocol.model.TerminationCause;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one chat session.
 *
 * <p>Produced only by {@link SessionReducer}. Optional facts (display name,
 * channels, termination cause) are held as nullable fields and exposed as
 * {@link Optional}.</p>
 */
public final class SessionState
{
    /** Channel the server places a client in after authentication. */
    public static final String DEFAULT_CHANNEL = "default";

    private final SessionPhase phase;
    private final String displayName;
    private final String confirmedChannel;
    private final String pendingChannel;
    private final boolean authenticated;
    private final PendingRequest pendingRequest;
    private final TerminationCause terminationCause;
    private final Instant lastTransition;

    private SessionState(SessionPhase phase,
                         String displayName,
                         String confirmedChannel,
                         String pendingChannel,
                         boolean authenticated,
                         PendingRequest pendingRequest,
                         TerminationCause terminationCause,
                         Instant lastTransition) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.displayName = displayName;
        this.confirmedChannel = confirmedChannel;
        this.pendingChannel = pendingChannel;
        this.authenticated = authenticated;
        this.pendingRequest = Objects.requireNonNull(pendingRequest, "pendingRequest");
        this.terminationCause = terminationCause;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    public static SessionState initial(Instant now) {
        return new SessionState(SessionPhase.INIT, null, null, null, false, PendingRequest.NONE, null, now);
    }

    public SessionPhase phase() {
        return phase;
    }

    public Optional<String> displayName() {
        return Optional.ofNullable(displayName);
    }

    public Optional<String> confirmedChannel() {
        return Optional.ofNullable(confirmedChannel);
    }

    public Optional<String> pendingChannel() {
        return Optional.ofNullable(pendingChannel);
    }

    public boolean authenticated() {
        return authenticated;
    }

    public PendingRequest pendingRequest() {
        return pendingRequest;
    }

    public boolean hasPendingRequest() {
        return pendingRequest != PendingRequest.NONE;
    }

    public Optional<TerminationCause> terminationCause() {
        return Optional.ofNullable(terminationCause);
    }

    public boolean isTerminated() {
        return phase == SessionPhase.TERMINATED;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    /** Authentication sent under {@code name}; reply outstanding. */
    public SessionState authenticating(String name, Instant now) {
        return new SessionState(SessionPhase.AUTHENTICATING, name, confirmedChannel, null,
                false, PendingRequest.AUTHENTICATION, null, now);
    }

    /** Authentication accepted. */
    public SessionState authenticatedInto(String channel, Instant now) {
        return new SessionState(SessionPhase.OPEN, displayName, channel, null,
                true, PendingRequest.NONE, null, now);
    }

    /** Back to {@code INIT}, keeping the display name for the next attempt. */
    public SessionState unauthenticated(Instant now) {
        return new SessionState(SessionPhase.INIT, displayName, null, null,
                false, PendingRequest.NONE, null, now);
    }

    /** Join sent for {@code channel}; reply outstanding. */
    public SessionState joining(String channel, Instant now) {
        return new SessionState(SessionPhase.JOIN_PENDING, displayName, confirmedChannel, channel,
                authenticated, PendingRequest.JOIN, null, now);
    }

    /** Join resolved; {@code channel} becomes the confirmed channel. */
    public SessionState open(String channel, Instant now) {
        return new SessionState(SessionPhase.OPEN, displayName, channel, null,
                authenticated, PendingRequest.NONE, null, now);
    }

    public SessionState withDisplayName(String name, Instant now) {
        return new SessionState(phase, name, confirmedChannel, pendingChannel,
                authenticated, pendingRequest, terminationCause, now);
    }

    /** Terminal. Channel and authentication facts are kept for the shutdown path. */
    public SessionState terminated(TerminationCause cause, Instant now) {
        return new SessionState(SessionPhase.TERMINATED, displayName, confirmedChannel, null,
                authenticated, PendingRequest.NONE, Objects.requireNonNull(cause, "cause"), now);
    }

    @Override
    public String toString() {
        return "SessionState{" + phase
                + ", displayName=" + displayName
                + ", channel=" + confirmedChannel
                + (pendingChannel != null ? ", pendingChannel=" + pendingChannel : "")
                + ", authenticated=" + authenticated
                + ", pending=" + pendingRequest
                + (terminationCause != null ? ", cause=" + terminationCause : "")
                + "}";
    }
}
