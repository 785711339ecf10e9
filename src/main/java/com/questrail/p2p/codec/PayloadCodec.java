package com.questrail.p2p.codec;

import com.questrail.p2p.api.Message;
import com.questrail.p2p.model.SerializedMessage;

/**
 * PayloadCodec
 * -----------------------------------------------------------------------------
 * Converts between user-facing {@link Message}s and their wire form
 * {@link SerializedMessage}.
 *
 * <p>Only the payload is transformed; topic and type pass through verbatim.
 * An absent payload maps to a zero-length byte array and back, and a
 * zero-length array is never handed to the underlying decoder.</p>
 */
public interface PayloadCodec
{
    /**
     * Serializes the payload of {@code message}.
     *
     * @throws EncodeException if the payload cannot be represented
     */
    SerializedMessage serialize(Message message);

    /**
     * Rebuilds a {@link Message} whose payload is decoded as {@code targetType}.
     *
     * @throws DecodeException if the payload bytes do not decode as {@code targetType}
     */
    default <T> Message deserialize(SerializedMessage message, Class<T> targetType) {
        T payload = decodePayload(message.payload(), targetType);
        return new Message(message.topic(), message.type(), payload);
    }

    /**
     * Decodes raw payload bytes as {@code targetType}.
     *
     * @return the decoded value, or {@code null} for an empty payload
     * @throws DecodeException if the bytes do not decode as {@code targetType}
     */
    <T> T decodePayload(byte[] payload, Class<T> targetType);
}
