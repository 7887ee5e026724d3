package com.questrail.chat.protocol.internal.exec;

import com.questrail.chat.api.SessionOutput;
import com.questrail.chat.protocol.codec.FrameEncodeException;
import com.questrail.chat.protocol.internal.shutdown.ShutdownCoordinator;
import com.questrail.chat.protocol.internal.state.SessionIntent;
import com.questrail.chat.protocol.internal.state.SessionIntents;
import com.questrail.chat.protocol.model.DeliveryOutcome;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.observability.ChatErrorEvent;
import com.questrail.chat.protocol.observability.ChatObservabilitySink;
import com.questrail.chat.protocol.transport.ProtocolTransport;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * TransportIntentExecutor
 * =============================================================================
 * Executes session intents against a {@link ProtocolTransport}, the user's
 * {@link SessionOutput} and the {@link ShutdownCoordinator}.
 *
 * <p>Intents run in the order the reducer emitted them. Sends do not wait for
 * their delivery outcome; a failed write is reported to the user as a local
 * error, an unconfirmed datagram only to observability.</p>
 */
public final class TransportIntentExecutor implements SessionIntentExecutor
{
    private final ProtocolTransport transport;
    private final SessionOutput output;
    private final ShutdownCoordinator shutdown;
    private final ChatObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    public TransportIntentExecutor(ProtocolTransport transport,
                                   SessionOutput output,
                                   ShutdownCoordinator shutdown,
                                   ChatObservabilitySink observabilitySink,
                                   Supplier<Instant> wallClock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.output = Objects.requireNonNull(output, "output");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void execute(SessionIntents intents) {
        Objects.requireNonNull(intents, "intents");

        for (SessionIntent intent : intents.asList()) {
            dispatch(intent);
        }
    }

    private void dispatch(SessionIntent intent) {
        if (intent instanceof SessionIntent.Send s) {
            send(s.command());
        }
        else if (intent instanceof SessionIntent.DeliverChat d) {
            output.onChatMessage(d.message().sender().orElse(""), d.message().content());
        }
        else if (intent instanceof SessionIntent.ReportReply r) {
            output.onReply(r.success(), r.content());
        }
        else if (intent instanceof SessionIntent.ReportRemoteError r) {
            output.onRemoteError(r.sender(), r.content());
        }
        else if (intent instanceof SessionIntent.ReportLocalError r) {
            output.onLocalError(r.description());
        }
        else if (intent instanceof SessionIntent.BeginShutdown b) {
            shutdown.shutdown(b.cause(), b.notice());
        }
    }

    private void send(OutboundCommand command) {
        try {
            transport.send(command).whenComplete((outcome, error) -> {
                if (error != null) {
                    output.onLocalError("failed to send " + label(command) + ": " + error.getMessage());
                    observabilitySink.onError(new ChatErrorEvent(wallClock.get(), "send failed", error));
                }
                else if (outcome == DeliveryOutcome.FAILED) {
                    output.onLocalError("failed to send " + label(command));
                }
            });
        } catch (FrameEncodeException e) {
            output.onLocalError(e.getMessage());
            observabilitySink.onError(new ChatErrorEvent(wallClock.get(),
                    "refused to encode " + label(command), e));
        }
    }

    private static String label(OutboundCommand command) {
        return command.getClass().getSimpleName();
    }
}
