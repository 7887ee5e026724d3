package com.questrail.chat.protocol.codec;

import com.questrail.chat.protocol.model.OutboundCommand;

import java.util.Optional;

/**
 * StreamFrameCodec
 * -----------------------------------------------------------------------------
 * Line-oriented text codec for the byte-stream transport.
 *
 * <p>This codec is also the single place where inbound text is interpreted:
 * the datagram codec re-renders its frames into the exact text this codec
 * decodes and delegates here, so both transports share one interpretation.</p>
 *
 * <p>The codec is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>splitting a byte stream into lines (the stream endpoint does that)</li>
 *   <li>deciding whether a decoded message is legal in the current session state</li>
 * </ul>
 */
public interface StreamFrameCodec
{
    /** Line terminator appended to every encoded frame. */
    String LINE_TERMINATOR = "\r\n";

    /**
     * Encode a command as one line of text, terminator included.
     *
     * @throws FrameEncodeException if a field violates the field rules
     */
    String encode(OutboundCommand command);

    /**
     * Decode one inbound server frame. A trailing line terminator, if present,
     * is ignored.
     *
     * @return the normalized message, or a malformed outcome naming the violation
     */
    InboundDecodeResult decode(String line);

    /**
     * Parse a client-to-server line back into the command that produced it.
     * Used by peers and tests that play the server side.
     */
    Optional<OutboundCommand> parseCommand(String line);
}
