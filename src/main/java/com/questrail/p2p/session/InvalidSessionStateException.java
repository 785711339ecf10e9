package com.questrail.p2p.session;

import com.questrail.p2p.api.MessagingException;

/**
 * Raised when a session is asked to advance from a terminal stage
 * ({@link SessionStage#CONSUMED} or {@link SessionStage#INACTIVE}).
 *
 * This is a programming error of the offending caller, not a network condition.
 */
public final class InvalidSessionStateException extends MessagingException
{
    public InvalidSessionStateException(String message) {
        super(message);
    }
}
