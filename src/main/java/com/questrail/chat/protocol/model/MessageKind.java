package com.questrail.chat.protocol.model;

/**
 * Kinds of inbound events both transports normalize into.
 */
public enum MessageKind
{
    /** A chat message relayed from another participant. */
    CHAT,

    /** The server's answer to the outstanding request. */
    REPLY,

    /** The server reports an error and is ending the session. */
    ERROR,

    /** The server is ending the session. */
    FAREWELL
}
