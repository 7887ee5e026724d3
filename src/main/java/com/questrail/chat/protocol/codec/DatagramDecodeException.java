package com.questrail.chat.protocol.codec;

/**
 * Indicates that a datagram could not be parsed into a structured frame.
 *
 * This typically reflects:
 * <ul>
 *   <li>a frame shorter than the minimum for its declared type</li>
 *   <li>an unknown type byte</li>
 *   <li>a missing field terminator, or bytes after the last field</li>
 *   <li>a reply result code other than 0 or 1</li>
 * </ul>
 */
public final class DatagramDecodeException extends RuntimeException
{
    public DatagramDecodeException(String message) {
        super(message);
    }
}
