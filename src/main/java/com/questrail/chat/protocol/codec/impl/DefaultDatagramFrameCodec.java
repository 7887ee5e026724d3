package com.questrail.chat.protocol.codec.impl;

import com.questrail.chat.protocol.codec.DatagramDecodeException;
import com.questrail.chat.protocol.codec.DatagramFrameCodec;
import com.questrail.chat.protocol.codec.FrameEncodeException;
import com.questrail.chat.protocol.codec.InboundDecodeResult;
import com.questrail.chat.protocol.codec.StreamFrameCodec;
import com.questrail.chat.protocol.internal.frame.DatagramFrame;
import com.questrail.chat.protocol.internal.frame.DatagramFrameType;
import com.questrail.chat.protocol.internal.frame.DatagramHeader;
import com.questrail.chat.protocol.model.OutboundCommand;
import com.questrail.chat.protocol.validation.FieldRules;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultDatagramFrameCodec
 * -----------------------------------------------------------------------------
 * Concrete {@link DatagramFrameCodec}.
 *
 * <p>Wire details:</p>
 * <ul>
 *   <li>identifiers (message and reply reference) are 16-bit little-endian</li>
 *   <li>text fields are US-ASCII, each terminated by {@code 0x00}</li>
 *   <li>a frame must carry exactly the field count of its type, with no trailing bytes</li>
 * </ul>
 */
public final class DefaultDatagramFrameCodec implements DatagramFrameCodec
{
    public static final ByteOrder ID_BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private final StreamFrameCodec textCodec;

    public DefaultDatagramFrameCodec() {
        this(new DefaultStreamFrameCodec());
    }

    public DefaultDatagramFrameCodec(StreamFrameCodec textCodec) {
        this.textCodec = Objects.requireNonNull(textCodec, "textCodec");
    }

    // -------------------------------------------------------------------------
    // Encode
    // -------------------------------------------------------------------------

    @Override
    public byte[] encode(DatagramFrame frame) {
        Objects.requireNonNull(frame, "frame");

        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        out.write(frame.type().code());
        writeId(out, frame.messageId());

        if (frame.type() == DatagramFrameType.REPLY) {
            out.write(frame.replySuccess() ? 1 : 0);
            writeId(out, frame.referenceId());
        }

        for (String field : frame.fields()) {
            byte[] bytes = field.getBytes(StandardCharsets.US_ASCII);
            out.write(bytes, 0, bytes.length);
            out.write(0);
        }
        return out.toByteArray();
    }

    @Override
    public byte[] encode(OutboundCommand command, int messageId) {
        Objects.requireNonNull(command, "command");

        DatagramFrame frame;
        if (command instanceof OutboundCommand.Authenticate c) {
            require(FieldRules.checkUsername(c.username()));
            require(FieldRules.checkDisplayName(c.displayName()));
            require(FieldRules.checkSecret(c.secret()));
            frame = DatagramFrame.of(DatagramFrameType.AUTH, messageId, c.username(), c.displayName(), c.secret());
        }
        else if (command instanceof OutboundCommand.Join c) {
            require(FieldRules.checkChannel(c.channel()));
            require(FieldRules.checkDisplayName(c.displayName()));
            frame = DatagramFrame.of(DatagramFrameType.JOIN, messageId, c.channel(), c.displayName());
        }
        else if (command instanceof OutboundCommand.ChatMessage c) {
            require(FieldRules.checkDisplayName(c.displayName()));
            require(FieldRules.checkContent(c.content()));
            frame = DatagramFrame.of(DatagramFrameType.MSG, messageId, c.displayName(), c.content());
        }
        else if (command instanceof OutboundCommand.Farewell c) {
            require(FieldRules.checkDisplayName(c.displayName()));
            frame = DatagramFrame.of(DatagramFrameType.BYE, messageId, c.displayName());
        }
        else if (command instanceof OutboundCommand.ErrorReport c) {
            require(FieldRules.checkDisplayName(c.displayName()));
            require(FieldRules.checkContent(c.content()));
            frame = DatagramFrame.of(DatagramFrameType.ERR, messageId, c.displayName(), c.content());
        }
        else {
            throw new IllegalArgumentException("Unsupported command: " + command);
        }
        return encode(frame);
    }

    // -------------------------------------------------------------------------
    // Decode
    // -------------------------------------------------------------------------

    @Override
    public DatagramFrame decode(byte[] datagram) {
        Objects.requireNonNull(datagram, "datagram");

        if (datagram.length < DatagramFrameType.HEADER_LENGTH) {
            throw new DatagramDecodeException("datagram too short: " + datagram.length + " bytes");
        }

        int code = datagram[0] & 0xFF;
        DatagramFrameType type = DatagramFrameType.fromCode(code)
                .orElseThrow(() -> new DatagramDecodeException(
                        String.format("unknown frame type 0x%02X", code)));

        if (datagram.length < type.minimumLength()) {
            throw new DatagramDecodeException(type + " frame too short: " + datagram.length
                    + " bytes, minimum " + type.minimumLength());
        }

        ByteBuffer buf = ByteBuffer.wrap(datagram).order(ID_BYTE_ORDER);
        buf.position(1);
        int messageId = buf.getShort() & 0xFFFF;

        boolean success = false;
        int referenceId = -1;
        if (type == DatagramFrameType.REPLY) {
            int result = buf.get() & 0xFF;
            if (result > 1) {
                throw new DatagramDecodeException("invalid REPLY result code " + result);
            }
            success = result == 1;
            referenceId = buf.getShort() & 0xFFFF;
        }

        List<String> fields = new ArrayList<>(type.fieldCount());
        int offset = buf.position();
        for (int i = 0; i < type.fieldCount(); i++) {
            int end = indexOfNul(datagram, offset);
            if (end < 0) {
                throw new DatagramDecodeException(type + " field " + (i + 1) + " is not terminated");
            }
            fields.add(new String(datagram, offset, end - offset, StandardCharsets.US_ASCII));
            offset = end + 1;
        }
        if (offset != datagram.length) {
            throw new DatagramDecodeException(type + " frame has " + (datagram.length - offset)
                    + " trailing bytes");
        }

        return new DatagramFrame(type, messageId, fields, success, referenceId);
    }

    @Override
    public InboundDecodeResult normalize(DatagramFrame frame) {
        Objects.requireNonNull(frame, "frame");

        String text = switch (frame.type()) {
            case REPLY -> CanonicalText.reply(frame.replySuccess(), frame.field(0));
            case MSG -> CanonicalText.chat(frame.field(0), frame.field(1));
            case ERR -> CanonicalText.error(frame.field(0), frame.field(1));
            case BYE -> CanonicalText.farewell(frame.field(0));
            default -> null;
        };
        if (text == null) {
            return new InboundDecodeResult.Malformed(
                    "unexpected " + frame.type() + " frame from server",
                    frame.type() + "#" + frame.messageId());
        }
        return textCodec.decode(text);
    }

    @Override
    public Optional<OutboundCommand> toCommand(DatagramFrame frame) {
        Objects.requireNonNull(frame, "frame");

        return switch (frame.type()) {
            case AUTH -> Optional.of(new OutboundCommand.Authenticate(frame.field(0), frame.field(1), frame.field(2)));
            case JOIN -> Optional.of(new OutboundCommand.Join(frame.field(0), frame.field(1)));
            case MSG -> Optional.of(new OutboundCommand.ChatMessage(frame.field(0), frame.field(1)));
            case BYE -> Optional.of(new OutboundCommand.Farewell(frame.field(0)));
            case ERR -> Optional.of(new OutboundCommand.ErrorReport(frame.field(0), frame.field(1)));
            default -> Optional.empty();
        };
    }

    @Override
    public Optional<DatagramHeader> readHeader(byte[] datagram) {
        Objects.requireNonNull(datagram, "datagram");
        if (datagram.length < DatagramFrameType.HEADER_LENGTH) {
            return Optional.empty();
        }
        int messageId = ByteBuffer.wrap(datagram, 1, 2).order(ID_BYTE_ORDER).getShort() & 0xFFFF;
        return DatagramFrameType.fromCode(datagram[0] & 0xFF)
                .map(type -> new DatagramHeader(type, messageId));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static void writeId(ByteArrayOutputStream out, int id) {
        if (ID_BYTE_ORDER == ByteOrder.LITTLE_ENDIAN) {
            out.write(id & 0xFF);
            out.write((id >>> 8) & 0xFF);
        }
        else {
            out.write((id >>> 8) & 0xFF);
            out.write(id & 0xFF);
        }
    }

    private static int indexOfNul(byte[] data, int from) {
        for (int i = from; i < data.length; i++) {
            if (data[i] == 0) {
                return i;
            }
        }
        return -1;
    }

    private static void require(Optional<String> violation) {
        if (violation.isPresent()) {
            throw new FrameEncodeException(violation.get());
        }
    }
}
