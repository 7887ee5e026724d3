package com.questrail.chat.protocol.internal.state;

import com.questrail.chat.api.SessionPhase;
import com.questrail.chat.protocol.internal.events.SessionCommandEvent;
import com.questrail.chat.protocol.internal.events.SessionEvent;
import com.questrail.chat.protocol.internal.events.SessionMessageEvent;
import com.questrail.chat.protocol.internal.events.SessionTimeoutEvent;
import com.questrail.chat.protocol.internal.events.SessionTransportEvent;
import com.questrail.chat.protocol.model.NormalizedMessage;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.model.TerminationCause;
import com.questrail.chat.protocol.validation.FieldRules;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one chat session.
 *
 * <p>Given a prior {@link SessionState} and a single {@link SessionEvent}, the
 * reducer computes a new state and the {@link SessionIntents} that should be
 * carried out. It performs no I/O, reads no clock and holds no state.</p>
 *
 * <h2>Transitions</h2>
 * <pre>
 *   INIT           --authenticate-->   AUTHENTICATING
 *   AUTHENTICATING --REPLY OK-->       OPEN (channel "default")
 *   AUTHENTICATING --REPLY NOK-->      INIT
 *   OPEN           --join-->           JOIN_PENDING
 *   JOIN_PENDING   --REPLY OK-->       OPEN (channel = pending channel)
 *   JOIN_PENDING   --REPLY NOK-->      OPEN (channel unchanged)
 *   any            --ERR | BYE | malformed | connection lost | leave--> TERMINATED
 * </pre>
 *
 * <h2>Reply disambiguation</h2>
 * A Reply carries no operation tag. Its meaning comes solely from
 * {@link SessionState#pendingRequest()}; a Reply with nothing pending is a
 * protocol fault.
 *
 * <h2>Local rejection</h2>
 * Commands that are illegal in the current state or carry invalid fields
 * leave the state untouched and produce only a
 * {@link SessionIntent.Kind#REPORT_LOCAL_ERROR} intent. Nothing reaches the wire.
 */
public final class SessionReducer
{
    /** Display name used in Error frames sent before the user chose one. */
    public static final String FALLBACK_DISPLAY_NAME = "client";

    /**
     * Result of applying an event to a session state.
     */
    public record Result(SessionState newState,
                         SessionIntents intents) {}

    public Result apply(SessionState state, SessionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (state.isTerminated()) {
            return onTerminated(state, event);
        }

        if (event instanceof SessionCommandEvent.Authenticate e) {
            return onAuthenticate(state, e);
        }
        if (event instanceof SessionCommandEvent.Join e) {
            return onJoin(state, e);
        }
        if (event instanceof SessionCommandEvent.SendMessage e) {
            return onSendMessage(state, e);
        }
        if (event instanceof SessionCommandEvent.Rename e) {
            return onRename(state, e);
        }
        if (event instanceof SessionCommandEvent.Leave e) {
            return onLeave(state, e);
        }
        if (event instanceof SessionMessageEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }
        if (event instanceof SessionMessageEvent.MalformedReceived e) {
            return protocolFault(state, e.reason(), e.timestamp());
        }
        if (event instanceof SessionTransportEvent.ConnectionLost e) {
            return onConnectionLost(state, e);
        }
        if (event instanceof SessionTimeoutEvent.ReplyTimeout e) {
            return onReplyTimeout(state, e);
        }

        return new Result(state, SessionIntents.none());
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private Result onAuthenticate(SessionState state, SessionCommandEvent.Authenticate e) {
        if (state.hasPendingRequest()) {
            return reject(state, "cannot authenticate: a " + describe(state.pendingRequest())
                    + " request is still waiting for its reply");
        }
        if (state.authenticated()) {
            return reject(state, "already authenticated");
        }

        Optional<String> violation = FieldRules.checkUsername(e.username())
                .or(() -> FieldRules.checkSecret(e.secret()))
                .or(() -> FieldRules.checkDisplayName(e.displayName()));
        if (violation.isPresent()) {
            return reject(state, violation.get());
        }

        return new Result(
                state.authenticating(e.displayName(), e.timestamp()),
                SessionIntents.sendAuthenticate(
                        new OutboundCommand.Authenticate(e.username(), e.displayName(), e.secret())));
    }

    private Result onJoin(SessionState state, SessionCommandEvent.Join e) {
        if (!state.authenticated()) {
            return reject(state, "cannot join: not authenticated");
        }
        if (state.hasPendingRequest()) {
            return reject(state, "cannot join: a " + describe(state.pendingRequest())
                    + " request is still waiting for its reply");
        }

        Optional<String> violation = FieldRules.checkChannel(e.channel());
        if (violation.isPresent()) {
            return reject(state, violation.get());
        }

        String name = state.displayName().orElse(FALLBACK_DISPLAY_NAME);
        return new Result(
                state.joining(e.channel(), e.timestamp()),
                SessionIntents.sendJoin(new OutboundCommand.Join(e.channel(), name)));
    }

    private Result onSendMessage(SessionState state, SessionCommandEvent.SendMessage e) {
        if (!state.phase().isAuthenticated()) {
            return reject(state, "cannot send message: not authenticated");
        }

        Optional<String> violation = FieldRules.checkContent(e.content());
        if (violation.isPresent()) {
            return reject(state, violation.get());
        }

        String name = state.displayName().orElse(FALLBACK_DISPLAY_NAME);
        return new Result(state,
                SessionIntents.sendMessage(new OutboundCommand.ChatMessage(name, e.content())));
    }

    private Result onRename(SessionState state, SessionCommandEvent.Rename e) {
        Optional<String> violation = FieldRules.checkDisplayName(e.displayName());
        if (violation.isPresent()) {
            return reject(state, violation.get());
        }
        return new Result(state.withDisplayName(e.displayName(), e.timestamp()), SessionIntents.none());
    }

    private Result onLeave(SessionState state, SessionCommandEvent.Leave e) {
        // Farewell only makes sense to a server that knows who we are.
        Optional<OutboundCommand> notice = state.authenticated()
                ? Optional.of(new OutboundCommand.Farewell(state.displayName().orElse(FALLBACK_DISPLAY_NAME)))
                : Optional.empty();

        return new Result(
                state.terminated(TerminationCause.USER_REQUEST, e.timestamp()),
                SessionIntents.beginShutdown(TerminationCause.USER_REQUEST, notice));
    }

    // ---------------------------------------------------------------------
    // Inbound messages
    // ---------------------------------------------------------------------

    private Result onMessageReceived(SessionState state, SessionMessageEvent.MessageReceived e) {
        NormalizedMessage message = e.message();

        switch (message.kind()) {
            case REPLY:
                return onReply(state, message, e.timestamp());

            case CHAT:
                if (!state.phase().isAuthenticated()) {
                    return new Result(state, SessionIntents.none());
                }
                return new Result(state, SessionIntents.deliverChat(message));

            case ERROR:
                return new Result(
                        state.terminated(TerminationCause.REMOTE_ERROR, e.timestamp()),
                        SessionIntents.reportRemoteError(message.sender().orElse("server"), message.content())
                                .and(SessionIntents.beginShutdown(TerminationCause.REMOTE_ERROR, Optional.empty())));

            case FAREWELL:
                return new Result(
                        state.terminated(TerminationCause.REMOTE_FAREWELL, e.timestamp()),
                        SessionIntents.beginShutdown(TerminationCause.REMOTE_FAREWELL, Optional.empty()));

            default:
                return protocolFault(state, "unsupported message kind " + message.kind(), e.timestamp());
        }
    }

    private Result onReply(SessionState state, NormalizedMessage reply, Instant now) {
        PendingRequest request = state.pendingRequest();
        boolean ok = reply.success();

        switch (request) {
            case AUTHENTICATION: {
                SessionState next = ok
                        ? state.authenticatedInto(SessionState.DEFAULT_CHANNEL, now)
                        : state.unauthenticated(now);
                return new Result(next, SessionIntents.reportReply(request, ok, reply.content()));
            }
            case JOIN: {
                String channel = ok
                        ? state.pendingChannel().orElse(state.confirmedChannel().orElse(SessionState.DEFAULT_CHANNEL))
                        : state.confirmedChannel().orElse(SessionState.DEFAULT_CHANNEL);
                return new Result(state.open(channel, now), SessionIntents.reportReply(request, ok, reply.content()));
            }
            default:
                return protocolFault(state, "unexpected REPLY with no request outstanding", now);
        }
    }

    // ---------------------------------------------------------------------
    // Faults and timeouts
    // ---------------------------------------------------------------------

    private Result protocolFault(SessionState state, String reason, Instant now) {
        String text = FieldRules.sanitizeContent(reason);
        OutboundCommand notice = new OutboundCommand.ErrorReport(
                state.displayName().orElse(FALLBACK_DISPLAY_NAME), text);

        return new Result(
                state.terminated(TerminationCause.PROTOCOL_FAULT, now),
                SessionIntents.reportLocalError("protocol fault: " + reason)
                        .and(SessionIntents.beginShutdown(TerminationCause.PROTOCOL_FAULT, Optional.of(notice))));
    }

    private Result onConnectionLost(SessionState state, SessionTransportEvent.ConnectionLost e) {
        return new Result(
                state.terminated(TerminationCause.CONNECTION_FAULT, e.timestamp()),
                SessionIntents.reportLocalError("connection lost: " + e.description())
                        .and(SessionIntents.beginShutdown(TerminationCause.CONNECTION_FAULT, Optional.empty())));
    }

    private Result onReplyTimeout(SessionState state, SessionTimeoutEvent.ReplyTimeout e) {
        // Stale: the request was resolved (or replaced) before the timer fired.
        if (state.pendingRequest() != e.request()) {
            return new Result(state, SessionIntents.none());
        }

        SessionState next;
        if (e.request() == PendingRequest.AUTHENTICATION) {
            next = state.unauthenticated(e.timestamp());
        } else {
            next = state.open(state.confirmedChannel().orElse(SessionState.DEFAULT_CHANNEL), e.timestamp());
        }
        return new Result(next, SessionIntents.reportLocalError(
                "no reply to " + describe(e.request()) + " request; giving up"));
    }

    private Result onTerminated(SessionState state, SessionEvent event) {
        if (event instanceof SessionCommandEvent && !(event instanceof SessionCommandEvent.Leave)) {
            return reject(state, "session has ended");
        }
        return new Result(state, SessionIntents.none());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Result reject(SessionState state, String description) {
        return new Result(state, SessionIntents.reportLocalError(description));
    }

    private static String describe(PendingRequest request) {
        return switch (request) {
            case AUTHENTICATION -> "authentication";
            case JOIN -> "join";
            case NONE -> "no";
        };
    }
}
