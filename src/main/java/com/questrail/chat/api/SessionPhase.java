package com.questrail.chat.api;

/**
 * Lifecycle phase of a chat session.
 *
 * <pre>
 *   INIT → AUTHENTICATING → OPEN ⇄ JOIN_PENDING
 *                 (any) → TERMINATED
 * </pre>
 */
public enum SessionPhase {
    /** Not authenticated; authentication may be attempted. */
    INIT,

    /** Authentication request sent, reply outstanding. */
    AUTHENTICATING,

    /** Authenticated, no request outstanding. */
    OPEN,

    /** Join request sent, reply outstanding. Chat still flows. */
    JOIN_PENDING,

    /** Terminal. */
    TERMINATED;

    public boolean isAuthenticated() {
        return this == OPEN || this == JOIN_PENDING;
    }
}
