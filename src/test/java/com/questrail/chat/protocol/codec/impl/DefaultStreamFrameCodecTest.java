package com.questrail.chat.protocol.codec.impl;

import com.questrail.chat.protocol.codec.FrameEncodeException;
import com.questrail.chat.protocol.codec.InboundDecodeResult;
import com.questrail.chat.protocol.model.MessageKind;
import com.questrail.chat.protocol.model.NormalizedMessage;
import com.questrail.chat.protocol.model.OutboundCommand;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultStreamFrameCodecTest
 * -----------------------------------------------------------------------------
 * Text framing: exact wire shapes on encode, leading-token dispatch and field
 * validation on decode.
 */
class DefaultStreamFrameCodecTest {

    private final DefaultStreamFrameCodec codec = new DefaultStreamFrameCodec();

    // ---------------------------------------------------------------------
    // Encode
    // ---------------------------------------------------------------------

    @Test
    void encodesEveryOutboundFrameWithCrlf() {
        assertEquals("AUTH bob AS Bob USING secret\r\n",
                codec.encode(new OutboundCommand.Authenticate("bob", "Bob", "secret")));
        assertEquals("JOIN general AS Bob\r\n",
                codec.encode(new OutboundCommand.Join("general", "Bob")));
        assertEquals("MSG FROM Bob IS hello there\r\n",
                codec.encode(new OutboundCommand.ChatMessage("Bob", "hello there")));
        assertEquals("BYE FROM Bob\r\n",
                codec.encode(new OutboundCommand.Farewell("Bob")));
        assertEquals("ERROR FROM Bob IS bad frame\r\n",
                codec.encode(new OutboundCommand.ErrorReport("Bob", "bad frame")));
    }

    @Test
    void refusesToEncodeInvalidFields() {
        assertThrows(FrameEncodeException.class,
                () -> codec.encode(new OutboundCommand.Authenticate("bad user", "Bob", "secret")));
        assertThrows(FrameEncodeException.class,
                () -> codec.encode(new OutboundCommand.Join("bad!channel", "Bob")));
        assertThrows(FrameEncodeException.class,
                () -> codec.encode(new OutboundCommand.ChatMessage("Bob Smith", "hi")));
        assertThrows(FrameEncodeException.class,
                () -> codec.encode(new OutboundCommand.ChatMessage("Bob", "")));
    }

    @Test
    void refusesMultiLineContentOnTheStream() {
        assertThrows(FrameEncodeException.class,
                () -> codec.encode(new OutboundCommand.ChatMessage("Bob", "two\nlines")));
    }

    @Test
    void authenticateRoundTripsThroughCommandParser() {
        OutboundCommand.Authenticate auth = new OutboundCommand.Authenticate("bob_1", "Bob!", "s3cr-et");

        Optional<OutboundCommand> parsed = codec.parseCommand(codec.encode(auth));

        assertEquals(Optional.of(auth), parsed);
    }

    // ---------------------------------------------------------------------
    // Decode
    // ---------------------------------------------------------------------

    @Test
    void decodesReplies() {
        assertEquals(decoded(NormalizedMessage.reply(true, "Joined")), codec.decode("REPLY OK IS Joined\r\n"));
        assertEquals(decoded(NormalizedMessage.reply(false, "Auth failed")), codec.decode("REPLY NOK IS Auth failed"));
    }

    @Test
    void decodesChatWithSender() {
        InboundDecodeResult result = codec.decode("MSG FROM Alice IS hi Bob\r\n");

        NormalizedMessage m = assertInstanceOf(InboundDecodeResult.Decoded.class, result).message();
        assertEquals(MessageKind.CHAT, m.kind());
        assertEquals(Optional.of("Alice"), m.sender());
        assertEquals("hi Bob", m.content());
    }

    @Test
    void decodesErrorAndFarewell() {
        assertEquals(decoded(NormalizedMessage.error("Server", "kicked")), codec.decode("ERROR FROM Server IS kicked"));
        assertEquals(decoded(NormalizedMessage.farewell("Server")), codec.decode("BYE FROM Server"));
    }

    @Test
    void keywordsAreCaseInsensitiveAndErrAliasIsAccepted() {
        assertEquals(decoded(NormalizedMessage.error("Server", "oops")), codec.decode("err from Server is oops"));
        assertEquals(decoded(NormalizedMessage.reply(true, "ok")), codec.decode("reply ok is ok"));
    }

    @Test
    void unrecognizedLeadingTokenIsMalformed() {
        InboundDecodeResult result = codec.decode("HELLO there");

        InboundDecodeResult.Malformed m = assertInstanceOf(InboundDecodeResult.Malformed.class, result);
        assertEquals("unrecognized frame", m.reason());
        assertEquals("HELLO there", m.raw());
    }

    @Test
    void invalidSenderMakesFrameMalformed() {
        String tooLong = "A".repeat(21);

        InboundDecodeResult result = codec.decode("MSG FROM " + tooLong + " IS hi");

        InboundDecodeResult.Malformed m = assertInstanceOf(InboundDecodeResult.Malformed.class, result);
        assertTrue(m.reason().startsWith("MSG with invalid display name"), m.reason());
    }

    @Test
    void emptyContentIsMalformed() {
        assertInstanceOf(InboundDecodeResult.Malformed.class, codec.decode("REPLY OK IS "));
    }

    @Test
    void nullLineIsMalformed() {
        assertInstanceOf(InboundDecodeResult.Malformed.class, codec.decode(null));
    }

    private static InboundDecodeResult decoded(NormalizedMessage message) {
        return new InboundDecodeResult.Decoded(message);
    }
}
