package com.questrail.chat.protocol.internal.state;

import com.questrail.chat.protocol.model.NormalizedMessage;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.model.TerminationCause;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered collection of {@link SessionIntent}s emitted by the
 * {@link SessionReducer}.
 *
 * <p>The reducer decides <b>what should happen next</b>; executors decide
 * <b>how</b>. Unlike a set, order matters here: a local error report must
 * reach the user before the shutdown it accompanies.</p>
 */
public final class SessionIntents
{
    private static final SessionIntents NONE = new SessionIntents(List.of());

    private final List<SessionIntent> intents;

    private SessionIntents(List<SessionIntent> intents) {
        this.intents = List.copyOf(intents);
    }

    public List<SessionIntent> asList() {
        return intents;
    }

    public boolean isEmpty() {
        return intents.isEmpty();
    }

    public boolean contains(SessionIntent.Kind kind) {
        for (SessionIntent intent : intents) {
            if (intent.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first intent of the given type, if present.
     */
    public <T extends SessionIntent> Optional<T> first(Class<T> type) {
        for (SessionIntent intent : intents) {
            if (type.isInstance(intent)) {
                return Optional.of(type.cast(intent));
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static SessionIntents none() {
        return NONE;
    }

    public static SessionIntents of(SessionIntent intent) {
        return new SessionIntents(List.of(Objects.requireNonNull(intent, "intent")));
    }

    public static SessionIntents sendAuthenticate(OutboundCommand.Authenticate command) {
        return of(new SessionIntent.Send(SessionIntent.Kind.SEND_AUTHENTICATE, command));
    }

    public static SessionIntents sendJoin(OutboundCommand.Join command) {
        return of(new SessionIntent.Send(SessionIntent.Kind.SEND_JOIN, command));
    }

    public static SessionIntents sendMessage(OutboundCommand.ChatMessage command) {
        return of(new SessionIntent.Send(SessionIntent.Kind.SEND_MESSAGE, command));
    }

    public static SessionIntents deliverChat(NormalizedMessage message) {
        return of(new SessionIntent.DeliverChat(message));
    }

    public static SessionIntents reportReply(PendingRequest request, boolean success, String content) {
        return of(new SessionIntent.ReportReply(request, success, content));
    }

    public static SessionIntents reportRemoteError(String sender, String content) {
        return of(new SessionIntent.ReportRemoteError(sender, content));
    }

    public static SessionIntents reportLocalError(String description) {
        return of(new SessionIntent.ReportLocalError(description));
    }

    public static SessionIntents beginShutdown(TerminationCause cause, Optional<OutboundCommand> notice) {
        return of(new SessionIntent.BeginShutdown(cause, notice));
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Returns a new instance with {@code other}'s intents appended.
     */
    public SessionIntents and(SessionIntents other) {
        Objects.requireNonNull(other, "other");
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        List<SessionIntent> merged = new ArrayList<>(intents.size() + other.intents.size());
        merged.addAll(intents);
        merged.addAll(other.intents);
        return new SessionIntents(merged);
    }

    @Override
    public String toString() {
        return intents.toString();
    }
}
