package com.questrail.chat.protocol.internal.reliability;

import com.questrail.chat.protocol.internal.time.Cancellable;
import com.questrail.chat.protocol.model.DeliveryOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * One outbound datagram awaiting acknowledgment. Retransmissions reuse
 * {@link #payload()} unchanged, identifier included.
 */
final class PendingAck
{
    private final int messageId;
    private final byte[] payload;
    private final CompletableFuture<DeliveryOutcome> completion;

    private int retransmissions;
    private Cancellable timer;

    PendingAck(int messageId, byte[] payload, CompletableFuture<DeliveryOutcome> completion) {
        this.messageId = messageId;
        this.payload = payload;
        this.completion = completion;
    }

    int messageId() {
        return messageId;
    }

    byte[] payload() {
        return payload;
    }

    CompletableFuture<DeliveryOutcome> completion() {
        return completion;
    }

    int retransmissions() {
        return retransmissions;
    }

    void recordRetransmission() {
        retransmissions++;
    }

    void arm(Cancellable timer) {
        this.timer = timer;
    }

    void disarm() {
        Cancellable t = timer;
        if (t != null) {
            t.cancel();
            timer = null;
        }
    }
}
