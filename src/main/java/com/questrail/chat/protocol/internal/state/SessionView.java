package com.questrail.chat.protocol.internal.state;

/**
 * Read-only, lock-free view of the live session, for components below the
 * session controller that need session context (deduplication, address binding).
 */
public interface SessionView
{
    boolean isAuthenticated();

    boolean hasPendingRequest();
}
