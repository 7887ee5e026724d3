package com.questrail.chat.protocol.internal.frame;

import java.util.Optional;

/**
 * Frame types of the datagram wire format, keyed by their leading byte.
 */
public enum DatagramFrameType
{
    CONFIRM(0x00, 0, 0),
    REPLY(0x01, 1, 3),
    AUTH(0x02, 3, 0),
    JOIN(0x03, 2, 0),
    MSG(0x04, 2, 0),
    PING(0xFD, 0, 0),
    ERR(0xFE, 2, 0),
    BYE(0xFF, 1, 0);

    /** Type byte + 16-bit identifier. */
    public static final int HEADER_LENGTH = 3;

    private final int code;
    private final int fieldCount;
    /** Bytes between the common header and the first text field (REPLY only). */
    private final int extraHeaderLength;

    DatagramFrameType(int code, int fieldCount, int extraHeaderLength) {
        this.code = code;
        this.fieldCount = fieldCount;
        this.extraHeaderLength = extraHeaderLength;
    }

    public int code() {
        return code;
    }

    /** Number of null-terminated text fields that follow the headers. */
    public int fieldCount() {
        return fieldCount;
    }

    /** Smallest well-formed frame: every field empty but terminated. */
    public int minimumLength() {
        return HEADER_LENGTH + extraHeaderLength + fieldCount;
    }

    /** Acknowledgment frames are never themselves acknowledged. */
    public boolean isAcknowledgment() {
        return this == CONFIRM;
    }

    public static Optional<DatagramFrameType> fromCode(int code) {
        for (DatagramFrameType t : values()) {
            if (t.code == (code & 0xFF)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
