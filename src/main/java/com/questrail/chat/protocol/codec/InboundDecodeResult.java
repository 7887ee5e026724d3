package com.questrail.chat.protocol.codec;

import com.questrail.chat.protocol.model.NormalizedMessage;

import java.util.Objects;

/**
 * InboundDecodeResult
 * -----------------------------------------------------------------------------
 * Outcome of decoding one inbound frame.
 *
 * <p>Malformed input is a value, not a dropped line: the session layer must be
 * able to react to it (report to the peer, terminate).</p>
 */
public sealed interface InboundDecodeResult
        permits InboundDecodeResult.Decoded, InboundDecodeResult.Malformed
{
    record Decoded(NormalizedMessage message) implements InboundDecodeResult {
        public Decoded {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * @param reason human-readable violation, safe to send in an Error frame
     * @param raw    printable rendering of the offending input, for diagnostics
     */
    record Malformed(String reason, String raw) implements InboundDecodeResult {
        public Malformed {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(raw, "raw");
        }
    }

    static InboundDecodeResult decoded(NormalizedMessage message) {
        return new Decoded(message);
    }

    static InboundDecodeResult malformed(String reason, String raw) {
        return new Malformed(reason, raw);
    }
}
