package com.questrail.p2p.dispatch;

import java.util.Objects;

/**
 * One row of the {@link HandlerRegistry}.
 */
public record HandlerEntry(
        String topic,
        String type,
        MessageHandler handler,
        ArgumentShape shape,
        Class<?> payloadType
) {
    public HandlerEntry {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(payloadType, "payloadType");
    }
}
