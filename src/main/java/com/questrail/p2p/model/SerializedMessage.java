package com.questrail.p2p.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Wire form of a {@link com.questrail.p2p.api.Message}: routing keys plus the
 * payload already reduced to bytes.
 *
 * <p>
 * An empty payload means "no payload". Equality compares payload bytes by
 * content, and the array is defensively copied on the way in and out.
 * </p>
 */
public record SerializedMessage(String topic, String type, byte[] payload)
{
    private static final byte[] EMPTY = new byte[0];

    public SerializedMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        payload = (payload == null) ? EMPTY : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    public boolean hasPayload() {
        return payload.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SerializedMessage that)) return false;
        return topic.equals(that.topic)
                && type.equals(that.type)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(topic, type);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "SerializedMessage[" +
                "topic=" + topic +
                ", type=" + type +
                ", payloadLength=" + payload.length +
                ']';
    }
}
