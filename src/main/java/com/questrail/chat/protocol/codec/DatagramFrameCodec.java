package com.questrail.chat.protocol.codec;

import com.questrail.chat.protocol.internal.frame.DatagramFrame;
import com.questrail.chat.protocol.internal.frame.DatagramHeader;
import com.questrail.chat.protocol.model.OutboundCommand;

import java.util.Optional;

/**
 * DatagramFrameCodec
 * -----------------------------------------------------------------------------
 * Binary codec for the datagram transport.
 *
 * <p>Byte-level work ({@link #encode(DatagramFrame)}, {@link #decode(byte[])})
 * is kept apart from interpretation ({@link #normalize(DatagramFrame)}), which
 * re-renders server frames into canonical stream text and delegates to the
 * stream decoder.</p>
 */
public interface DatagramFrameCodec
{
    /**
     * Encode any structured frame to its wire bytes.
     */
    byte[] encode(DatagramFrame frame);

    /**
     * Encode a client command under the given message identifier.
     *
     * @throws FrameEncodeException if a field violates the field rules
     */
    byte[] encode(OutboundCommand command, int messageId);

    /**
     * Parse one complete datagram.
     *
     * @throws DatagramDecodeException if the datagram is truncated or otherwise
     *                                 not a well-formed frame
     */
    DatagramFrame decode(byte[] datagram);

    /**
     * Read only the type byte and message identifier. Empty when the datagram
     * is shorter than the header or carries an unknown type.
     */
    Optional<DatagramHeader> readHeader(byte[] datagram);

    /**
     * Interpret a server frame (REPLY, MSG, ERR, BYE) through the stream decoder.
     * Any other frame type yields a malformed outcome.
     */
    InboundDecodeResult normalize(DatagramFrame frame);

    /**
     * Reconstruct the client command carried by a client frame (AUTH, JOIN, MSG,
     * BYE, ERR). Used by peers and tests that play the server side.
     */
    Optional<OutboundCommand> toCommand(DatagramFrame frame);
}
