package com.questrail.chat.protocol.codec.impl;

import com.questrail.chat.protocol.codec.FrameEncodeException;
import com.questrail.chat.protocol.codec.InboundDecodeResult;
import com.questrail.chat.protocol.codec.StreamFrameCodec;
import com.questrail.chat.protocol.model.NormalizedMessage;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.validation.FieldRules;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DefaultStreamFrameCodec
 * -----------------------------------------------------------------------------
 * Concrete {@link StreamFrameCodec}.
 *
 * <p>Inbound dispatch is on the leading token; keywords match case-insensitively
 * and both {@code ERR FROM} and {@code ERROR FROM} are accepted for errors.
 * Every extracted field is checked against {@link FieldRules}; a violation makes
 * the whole frame malformed.</p>
 */
public final class DefaultStreamFrameCodec implements StreamFrameCodec
{
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern REPLY = Pattern.compile("REPLY (OK|NOK) IS (.*)", FLAGS);
    private static final Pattern ERROR = Pattern.compile("ERR(?:OR)? FROM (\\S+) IS (.*)", FLAGS);
    private static final Pattern FAREWELL = Pattern.compile("BYE FROM (\\S+)", FLAGS);
    private static final Pattern CHAT = Pattern.compile("MSG FROM (\\S+) IS (.*)", FLAGS);

    private static final Pattern AUTH = Pattern.compile("AUTH (\\S+) AS (\\S+) USING (\\S+)", FLAGS);
    private static final Pattern JOIN = Pattern.compile("JOIN (\\S+) AS (\\S+)", FLAGS);

    @Override
    public String encode(OutboundCommand command) {
        String text;
        if (command instanceof OutboundCommand.Authenticate c) {
            require(FieldRules.checkUsername(c.username()));
            require(FieldRules.checkDisplayName(c.displayName()));
            require(FieldRules.checkSecret(c.secret()));
            text = CanonicalText.authenticate(c.username(), c.displayName(), c.secret());
        }
        else if (command instanceof OutboundCommand.Join c) {
            require(FieldRules.checkChannel(c.channel()));
            require(FieldRules.checkDisplayName(c.displayName()));
            text = CanonicalText.join(c.channel(), c.displayName());
        }
        else if (command instanceof OutboundCommand.ChatMessage c) {
            require(FieldRules.checkDisplayName(c.displayName()));
            requireContent(c.content());
            text = CanonicalText.chat(c.displayName(), c.content());
        }
        else if (command instanceof OutboundCommand.Farewell c) {
            require(FieldRules.checkDisplayName(c.displayName()));
            text = CanonicalText.farewell(c.displayName());
        }
        else if (command instanceof OutboundCommand.ErrorReport c) {
            require(FieldRules.checkDisplayName(c.displayName()));
            requireContent(c.content());
            text = CanonicalText.error(c.displayName(), c.content());
        }
        else {
            throw new IllegalArgumentException("Unsupported command: " + command);
        }
        return text + LINE_TERMINATOR;
    }

    @Override
    public InboundDecodeResult decode(String line) {
        if (line == null) {
            return InboundDecodeResult.malformed("empty frame", "");
        }
        String text = stripTerminator(line);

        Matcher m = REPLY.matcher(text);
        if (m.matches()) {
            String content = m.group(2);
            Optional<String> violation = FieldRules.checkContent(content);
            if (violation.isPresent()) {
                return InboundDecodeResult.malformed("REPLY with " + violation.get(), printable(text));
            }
            return InboundDecodeResult.decoded(NormalizedMessage.reply("OK".equalsIgnoreCase(m.group(1)), content));
        }

        m = ERROR.matcher(text);
        if (m.matches()) {
            return senderAndContent(text, m, "ERR", NormalizedMessage::error);
        }

        m = FAREWELL.matcher(text);
        if (m.matches()) {
            Optional<String> violation = FieldRules.checkDisplayName(m.group(1));
            if (violation.isPresent()) {
                return InboundDecodeResult.malformed("BYE with " + violation.get(), printable(text));
            }
            return InboundDecodeResult.decoded(NormalizedMessage.farewell(m.group(1)));
        }

        m = CHAT.matcher(text);
        if (m.matches()) {
            return senderAndContent(text, m, "MSG", NormalizedMessage::chat);
        }

        return InboundDecodeResult.malformed("unrecognized frame", printable(text));
    }

    @Override
    public Optional<OutboundCommand> parseCommand(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String text = stripTerminator(line);

        Matcher m = AUTH.matcher(text);
        if (m.matches()) {
            return Optional.of(new OutboundCommand.Authenticate(m.group(1), m.group(2), m.group(3)));
        }
        m = JOIN.matcher(text);
        if (m.matches()) {
            return Optional.of(new OutboundCommand.Join(m.group(1), m.group(2)));
        }
        m = CHAT.matcher(text);
        if (m.matches()) {
            return Optional.of(new OutboundCommand.ChatMessage(m.group(1), m.group(2)));
        }
        m = FAREWELL.matcher(text);
        if (m.matches()) {
            return Optional.of(new OutboundCommand.Farewell(m.group(1)));
        }
        m = ERROR.matcher(text);
        if (m.matches()) {
            return Optional.of(new OutboundCommand.ErrorReport(m.group(1), m.group(2)));
        }
        return Optional.empty();
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private interface SenderContentFactory {
        NormalizedMessage create(String sender, String content);
    }

    private static InboundDecodeResult senderAndContent(String text,
                                                        Matcher m,
                                                        String label,
                                                        SenderContentFactory factory) {
        String sender = m.group(1);
        String content = m.group(2);

        Optional<String> violation = FieldRules.checkDisplayName(sender)
                .or(() -> FieldRules.checkContent(content));
        if (violation.isPresent()) {
            return InboundDecodeResult.malformed(label + " with " + violation.get(), printable(text));
        }
        return InboundDecodeResult.decoded(factory.create(sender, content));
    }

    private static void require(Optional<String> violation) {
        if (violation.isPresent()) {
            throw new FrameEncodeException(violation.get());
        }
    }

    private static void requireContent(String content) {
        require(FieldRules.checkContent(content));
        if (content.indexOf('\n') >= 0) {
            throw new FrameEncodeException("message content cannot span lines on the stream transport");
        }
    }

    private static String stripTerminator(String line) {
        if (line.endsWith(LINE_TERMINATOR)) {
            return line.substring(0, line.length() - LINE_TERMINATOR.length());
        }
        if (line.endsWith("\n")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    static String printable(String text) {
        StringBuilder sb = new StringBuilder(Math.min(text.length(), 128));
        for (int i = 0; i < text.length() && i < 128; i++) {
            char c = text.charAt(i);
            sb.append(c >= 0x20 && c <= 0x7E ? c : '.');
        }
        return sb.toString();
    }
}
