package com.questrail.chat.protocol.internal.reliability;

import com.questrail.chat.protocol.internal.frame.DatagramFrame;

/**
 * Per-session 16-bit message identifier counter, starting at 0 and wrapping
 * modulo 65536. Not thread-safe; guarded by {@link ReliabilityEngine}.
 */
final class MessageIdAllocator
{
    private int next;

    /** The identifier the next {@link #next()} call will return. */
    int peek() {
        return next;
    }

    int next() {
        int id = next;
        next = (next + 1) & DatagramFrame.MAX_MESSAGE_ID;
        return id;
    }
}
