package com.questrail.chat.protocol.internal.events;

import java.time.Instant;

/**
 * User intent entering the session.
 *
 * <p>Field values are raw user input; the reducer validates them.</p>
 */
public sealed interface SessionCommandEvent extends SessionEvent
        permits SessionCommandEvent.Authenticate,
                SessionCommandEvent.Join,
                SessionCommandEvent.SendMessage,
                SessionCommandEvent.Rename,
                SessionCommandEvent.Leave
{
    final class Authenticate extends SessionEvent.Base implements SessionCommandEvent {
        private final String username;
        private final String secret;
        private final String displayName;

        public Authenticate(Instant timestamp, String username, String secret, String displayName) {
            super(timestamp);
            this.username = username;
            this.secret = secret;
            this.displayName = displayName;
        }

        public String username() {
            return username;
        }

        public String secret() {
            return secret;
        }

        public String displayName() {
            return displayName;
        }
    }

    final class Join extends SessionEvent.Base implements SessionCommandEvent {
        private final String channel;

        public Join(Instant timestamp, String channel) {
            super(timestamp);
            this.channel = channel;
        }

        public String channel() {
            return channel;
        }
    }

    final class SendMessage extends SessionEvent.Base implements SessionCommandEvent {
        private final String content;

        public SendMessage(Instant timestamp, String content) {
            super(timestamp);
            this.content = content;
        }

        public String content() {
            return content;
        }
    }

    final class Rename extends SessionEvent.Base implements SessionCommandEvent {
        private final String displayName;

        public Rename(Instant timestamp, String displayName) {
            super(timestamp);
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    final class Leave extends SessionEvent.Base implements SessionCommandEvent {
        public Leave(Instant timestamp) {
            super(timestamp);
        }
    }
}
