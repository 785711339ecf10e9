package com.questrail.p2p.api;

import java.util.Objects;

/**
 * User-facing unit of communication.
 *
 * <p>
 * {@code topic} is the protocol-level namespace (e.g. {@code "KAD"}) and
 * {@code type} the message kind within it (e.g. {@code "FIND_NODE"}). Together
 * they select the handler on the receiving node.
 * </p>
 *
 * <p>
 * The payload may be any value the payload codec can serialize, or
 * {@code null} when the message carries no payload.
 * </p>
 */
public record Message(String topic, String type, Object payload)
{
    public Message {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
    }

    public static Message of(String topic, String type) {
        return new Message(topic, type, null);
    }

    public static Message of(String topic, String type, Object payload) {
        return new Message(topic, type, payload);
    }

    public boolean hasPayload() {
        return payload != null;
    }
}
