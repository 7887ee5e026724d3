package com.questrail.chat.protocol.config;

/**
 * Wire binding selected at startup.
 */
public enum TransportKind
{
    /** Line-delimited text frames over a TCP connection. */
    TCP,

    /** Binary frames over UDP, with acknowledgment and retransmission. */
    UDP
}
