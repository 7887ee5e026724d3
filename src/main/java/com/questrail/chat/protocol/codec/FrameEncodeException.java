package com.questrail.chat.protocol.codec;

/**
 * Thrown when an outbound command cannot be encoded because one of its fields
 * violates the protocol field rules.
 */
public final class FrameEncodeException extends RuntimeException
{
    public FrameEncodeException(String message) {
        super(message);
    }
}
