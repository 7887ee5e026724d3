package com.questrail.chat.protocol.internal.state;

/**
 * Which outstanding request the next inbound Reply resolves.
 *
 * <p>The wire Reply carries no operation tag; at most one request is
 * outstanding at a time and this value is the only correlation.</p>
 */
public enum PendingRequest {
    NONE,
    AUTHENTICATION,
    JOIN
}
