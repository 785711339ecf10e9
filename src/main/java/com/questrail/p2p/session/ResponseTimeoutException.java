package com.questrail.p2p.session;

import com.questrail.p2p.api.MessagingException;

import java.time.Duration;

/**
 * Raised to a request/response caller when no correlated response arrived
 * before the deadline. The pending slot has been evicted by the time this is
 * thrown; a late response for the same session is dropped.
 */
public final class ResponseTimeoutException extends MessagingException
{
    private final int sessionId;
    private final Duration timeout;

    public ResponseTimeoutException(int sessionId, Duration timeout) {
        super("No response for session " + sessionId + " within " + timeout);
        this.sessionId = sessionId;
        this.timeout = timeout;
    }

    public ResponseTimeoutException(int sessionId, Duration timeout, Throwable cause) {
        super("No response for session " + sessionId + " within " + timeout, cause);
        this.sessionId = sessionId;
        this.timeout = timeout;
    }

    public int sessionId() {
        return sessionId;
    }

    public Duration timeout() {
        return timeout;
    }
}
