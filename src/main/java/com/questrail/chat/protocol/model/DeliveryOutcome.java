package com.questrail.chat.protocol.model;

/**
 * Result of handing one outbound frame to a transport.
 */
public enum DeliveryOutcome
{
    /** Written to the stream, or acknowledged by the datagram peer. */
    DELIVERED,

    /** Retry budget exhausted; the frame was sent once more without confirmation. */
    UNCONFIRMED,

    /** The wait was cut short by shutdown. Not a protocol failure. */
    ABORTED,

    /** The transport could not send at all. */
    FAILED
}
