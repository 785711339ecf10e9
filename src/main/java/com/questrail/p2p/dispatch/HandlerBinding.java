package com.questrail.p2p.dispatch;

import java.util.Objects;

/**
 * A handler together with the argument shape and payload type it was written
 * for. Usually built through {@link Handlers}.
 *
 * @param payloadType type the payload is decoded as; ignored when the shape has no PAYLOAD
 */
public record HandlerBinding(Class<?> payloadType, MessageHandler handler, ArgumentShape shape)
{
    public HandlerBinding {
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(shape, "shape");
        if (shape.requiresPayload() && payloadType == null) {
            throw new IllegalArgumentException("payloadType is required for shape " + shape);
        }
        if (!shape.requiresPayload()) {
            payloadType = Void.class;
        }
    }
}
