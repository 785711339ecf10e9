package com.questrail.p2p.transport;

import com.questrail.p2p.api.MessagingException;

/**
 * Bind, connect or write failure of a transport binding.
 */
public final class TransportException extends MessagingException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
