package com.questrail.p2p.dispatch;

import com.questrail.p2p.api.MessagingException;

/**
 * Raised at registration time when a handler already exists for the same
 * {@code (topic, type)} pair. Only one handler per pair is supported.
 */
public final class DuplicateHandlerException extends MessagingException
{
    public DuplicateHandlerException(String topic, String type) {
        super("Handler already registered for topic=" + topic + ", type=" + type);
    }
}
