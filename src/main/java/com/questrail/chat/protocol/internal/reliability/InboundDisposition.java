package com.questrail.chat.protocol.internal.reliability;

/**
 * What the transport should do with an inbound datagram after the
 * reliability engine has seen it.
 */
public enum InboundDisposition {
    /** New application frame: normalize and publish it. */
    PROCESS,

    /** Already processed; acknowledged again, not republished. */
    DUPLICATE,

    /** Acknowledgment or keepalive; consumed by the engine. */
    CONTROL
}
