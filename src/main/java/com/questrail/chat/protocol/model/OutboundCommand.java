package com.questrail.chat.protocol.model;

import java.util.Objects;

/**
 * OutboundCommand
 * -----------------------------------------------------------------------------
 * Semantic client-to-server frames, independent of wire format.
 *
 * <p>Field order in each record matches the field order on the datagram wire.</p>
 */
public sealed interface OutboundCommand
        permits OutboundCommand.Authenticate,
                OutboundCommand.Join,
                OutboundCommand.ChatMessage,
                OutboundCommand.Farewell,
                OutboundCommand.ErrorReport
{
    record Authenticate(String username, String displayName, String secret) implements OutboundCommand {
        public Authenticate {
            Objects.requireNonNull(username, "username");
            Objects.requireNonNull(displayName, "displayName");
            Objects.requireNonNull(secret, "secret");
        }
    }

    record Join(String channel, String displayName) implements OutboundCommand {
        public Join {
            Objects.requireNonNull(channel, "channel");
            Objects.requireNonNull(displayName, "displayName");
        }
    }

    record ChatMessage(String displayName, String content) implements OutboundCommand {
        public ChatMessage {
            Objects.requireNonNull(displayName, "displayName");
            Objects.requireNonNull(content, "content");
        }
    }

    record Farewell(String displayName) implements OutboundCommand {
        public Farewell {
            Objects.requireNonNull(displayName, "displayName");
        }
    }

    record ErrorReport(String displayName, String content) implements OutboundCommand {
        public ErrorReport {
            Objects.requireNonNull(displayName, "displayName");
            Objects.requireNonNull(content, "content");
        }
    }
}
