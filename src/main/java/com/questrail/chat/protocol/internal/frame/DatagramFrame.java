package com.questrail.chat.protocol.internal.frame;

import java.util.List;
import java.util.Objects;

/**
 * DatagramFrame
 * =============================================================================
 * Structured, post-wire representation of one datagram.
 *
 * <h2>Layout</h2>
 * <pre>
 *   [type:1][messageId:2][field1 0x00 field2 0x00 ...]
 *   REPLY: [type:1][messageId:2][result:1][referenceId:2][content 0x00]
 * </pre>
 *
 * <p>{@code replySuccess} and {@code referenceId} carry meaning only for
 * {@link DatagramFrameType#REPLY}; other types hold {@code false} / {@code -1}.</p>
 */
public record DatagramFrame(DatagramFrameType type,
                            int messageId,
                            List<String> fields,
                            boolean replySuccess,
                            int referenceId)
{
    public static final int MAX_MESSAGE_ID = 0xFFFF;

    public DatagramFrame {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fields, "fields");
        if (messageId < 0 || messageId > MAX_MESSAGE_ID) {
            throw new IllegalArgumentException("messageId out of range: " + messageId);
        }
        if (fields.size() != type.fieldCount()) {
            throw new IllegalArgumentException(type + " carries " + type.fieldCount()
                    + " fields, got " + fields.size());
        }
        fields = List.copyOf(fields);
    }

    public static DatagramFrame of(DatagramFrameType type, int messageId, String... fields) {
        if (type == DatagramFrameType.REPLY) {
            throw new IllegalArgumentException("use DatagramFrame.reply(...) for REPLY frames");
        }
        return new DatagramFrame(type, messageId, List.of(fields), false, -1);
    }

    public static DatagramFrame confirm(int messageId) {
        return of(DatagramFrameType.CONFIRM, messageId);
    }

    public static DatagramFrame reply(int messageId, boolean success, int referenceId, String content) {
        if (referenceId < 0 || referenceId > MAX_MESSAGE_ID) {
            throw new IllegalArgumentException("referenceId out of range: " + referenceId);
        }
        return new DatagramFrame(DatagramFrameType.REPLY, messageId, List.of(content), success, referenceId);
    }

    public String field(int index) {
        return fields.get(index);
    }
}
