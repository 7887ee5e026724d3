package com.questrail.chat.protocol.internal.state;

import com.questrail.chat.protocol.model.NormalizedMessage;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.model.TerminationCause;

import java.util.Objects;
import java.util.Optional;

/**
 * One desired action emitted by {@link SessionReducer}. No intent performs I/O.
 */
public sealed interface SessionIntent
        permits SessionIntent.Send,
                SessionIntent.DeliverChat,
                SessionIntent.ReportReply,
                SessionIntent.ReportRemoteError,
                SessionIntent.ReportLocalError,
                SessionIntent.BeginShutdown
{
    enum Kind {
        /** Transmit an authenticate frame; a reply becomes outstanding. */
        SEND_AUTHENTICATE,

        /** Transmit a join frame; a reply becomes outstanding. */
        SEND_JOIN,

        /** Transmit a chat message. */
        SEND_MESSAGE,

        /** Surface an inbound chat message to the user. */
        DELIVER_CHAT,

        /** Surface the outcome of the outstanding request. */
        REPORT_REPLY,

        /** Surface an error reported by the server. */
        REPORT_REMOTE_ERROR,

        /** Surface a local rejection or fault. */
        REPORT_LOCAL_ERROR,

        /** Run the bounded shutdown sequence. */
        BEGIN_SHUTDOWN
    }

    Kind kind();

    record Send(Kind kind, OutboundCommand command) implements SessionIntent {
        public Send {
            Objects.requireNonNull(command, "command");
            if (kind != Kind.SEND_AUTHENTICATE && kind != Kind.SEND_JOIN && kind != Kind.SEND_MESSAGE) {
                throw new IllegalArgumentException("not a send kind: " + kind);
            }
        }
    }

    record DeliverChat(NormalizedMessage message) implements SessionIntent {
        @Override
        public Kind kind() {
            return Kind.DELIVER_CHAT;
        }
    }

    record ReportReply(PendingRequest request, boolean success, String content) implements SessionIntent {
        @Override
        public Kind kind() {
            return Kind.REPORT_REPLY;
        }
    }

    record ReportRemoteError(String sender, String content) implements SessionIntent {
        @Override
        public Kind kind() {
            return Kind.REPORT_REMOTE_ERROR;
        }
    }

    record ReportLocalError(String description) implements SessionIntent {
        @Override
        public Kind kind() {
            return Kind.REPORT_LOCAL_ERROR;
        }
    }

    /**
     * @param notice frame to send to the peer before closing, if any
     */
    record BeginShutdown(TerminationCause cause, Optional<OutboundCommand> notice) implements SessionIntent {
        public BeginShutdown {
            Objects.requireNonNull(cause, "cause");
            Objects.requireNonNull(notice, "notice");
        }

        @Override
        public Kind kind() {
            return Kind.BEGIN_SHUTDOWN;
        }
    }
}
