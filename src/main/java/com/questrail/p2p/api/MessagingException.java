package com.questrail.p2p.api;

/**
 * Root of the messaging engine's exception hierarchy.
 *
 * All subclasses are unchecked: receive-path failures are recovered locally
 * and reported to the observability sink, caller-path failures propagate to
 * the immediate caller.
 */
public class MessagingException extends RuntimeException
{
    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
