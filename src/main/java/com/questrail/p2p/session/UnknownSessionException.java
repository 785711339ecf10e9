package com.questrail.p2p.session;

import com.questrail.p2p.api.MessagingException;

/**
 * Raised when a caller awaits a session id that has no pending slot, either
 * because it was never registered or because it has already been evicted.
 */
public final class UnknownSessionException extends MessagingException
{
    private final int sessionId;

    public UnknownSessionException(int sessionId) {
        super("Unknown session: " + sessionId);
        this.sessionId = sessionId;
    }

    public int sessionId() {
        return sessionId;
    }
}
