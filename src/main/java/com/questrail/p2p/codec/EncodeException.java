package com.questrail.p2p.codec;

import com.questrail.p2p.api.MessagingException;

/**
 * Indicates that an outbound payload or package could not be written, for
 * example a payload type Jackson cannot serialize.
 *
 * Raised on the caller's thread before anything reaches the network.
 */
public final class EncodeException extends MessagingException
{
    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
