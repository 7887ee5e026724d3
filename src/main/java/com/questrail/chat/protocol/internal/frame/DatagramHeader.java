package com.questrail.chat.protocol.internal.frame;

/**
 * Type and message identifier of a datagram whose body may not parse.
 *
 * <p>Both sit in the first {@link DatagramFrameType#HEADER_LENGTH} bytes, so a
 * datagram with a known type byte can still be acknowledged even when its
 * fields are broken.</p>
 */
public record DatagramHeader(DatagramFrameType type, int messageId)
{
}
