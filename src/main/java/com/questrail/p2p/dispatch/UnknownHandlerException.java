package com.questrail.p2p.dispatch;

import com.questrail.p2p.api.MessagingException;

/**
 * No handler is registered for a {@code (topic, type)} pair.
 */
public final class UnknownHandlerException extends MessagingException
{
    private final String topic;
    private final String type;

    public UnknownHandlerException(String topic, String type) {
        super("No handler registered for topic=" + topic + ", type=" + type);
        this.topic = topic;
        this.type = type;
    }

    public String topic() {
        return topic;
    }

    public String type() {
        return type;
    }
}
