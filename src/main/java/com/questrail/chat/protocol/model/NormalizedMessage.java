package com.questrail.chat.protocol.model;

import java.util.Objects;
import java.util.Optional;

/**
 * NormalizedMessage
 * -----------------------------------------------------------------------------
 * The single internal representation of an inbound protocol event.
 *
 * <p>Both the stream and the datagram transport converge on this type. Once a
 * {@code NormalizedMessage} exists, nothing downstream can tell (or needs to
 * know) which transport produced it; two transports observing the same logical
 * event produce {@linkplain #equals(Object) equal} instances.</p>
 *
 * <ul>
 *   <li>{@link MessageKind#CHAT}: sender + content</li>
 *   <li>{@link MessageKind#REPLY}: success flag + content, no sender</li>
 *   <li>{@link MessageKind#ERROR}: sender + content</li>
 *   <li>{@link MessageKind#FAREWELL}: sender, empty content</li>
 * </ul>
 */
public final class NormalizedMessage
{
    private final MessageKind kind;
    private final String content;
    private final String sender;
    private final boolean success;

    private NormalizedMessage(MessageKind kind, String content, String sender, boolean success) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.content = Objects.requireNonNull(content, "content");
        this.sender = sender;
        this.success = success;
    }

    public static NormalizedMessage chat(String sender, String content) {
        return new NormalizedMessage(MessageKind.CHAT, content, Objects.requireNonNull(sender, "sender"), false);
    }

    public static NormalizedMessage reply(boolean success, String content) {
        return new NormalizedMessage(MessageKind.REPLY, content, null, success);
    }

    public static NormalizedMessage error(String sender, String content) {
        return new NormalizedMessage(MessageKind.ERROR, content, Objects.requireNonNull(sender, "sender"), false);
    }

    public static NormalizedMessage farewell(String sender) {
        return new NormalizedMessage(MessageKind.FAREWELL, "", Objects.requireNonNull(sender, "sender"), false);
    }

    public MessageKind kind() {
        return kind;
    }

    public String content() {
        return content;
    }

    public Optional<String> sender() {
        return Optional.ofNullable(sender);
    }

    /**
     * Reply outcome. Always {@code false} for non-reply kinds.
     */
    public boolean success() {
        return success;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizedMessage other)) {
            return false;
        }
        return kind == other.kind
                && success == other.success
                && content.equals(other.content)
                && Objects.equals(sender, other.sender);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, content, sender, success);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case REPLY -> "REPLY[" + (success ? "OK" : "NOK") + ", " + content + "]";
            case FAREWELL -> "FAREWELL[" + sender + "]";
            default -> kind + "[" + sender + ", " + content + "]";
        };
    }
}
