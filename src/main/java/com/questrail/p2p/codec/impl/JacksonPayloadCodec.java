package com.questrail.p2p.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.p2p.api.Message;
import com.questrail.p2p.codec.DecodeException;
import com.questrail.p2p.codec.EncodeException;
import com.questrail.p2p.codec.PayloadCodec;
import com.questrail.p2p.model.SerializedMessage;

import java.io.IOException;
import java.util.Objects;

/**
 * JacksonPayloadCodec
 * -----------------------------------------------------------------------------
 * {@link PayloadCodec} that writes payloads as JSON.
 *
 * <p>Any value Jackson can bind works as a payload: strings, numbers, byte
 * arrays (base64), collections, records and plain beans. The receiving side
 * names the type to bind to; a payload sent as a record may be read back as a
 * compatible record, bean or {@code Map}.</p>
 */
public final class JacksonPayloadCodec implements PayloadCodec
{
    private static final byte[] NO_PAYLOAD = new byte[0];

    private final ObjectMapper mapper;

    public JacksonPayloadCodec() {
        this(ObjectMappers.standard());
    }

    public JacksonPayloadCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public SerializedMessage serialize(Message message) {
        Objects.requireNonNull(message, "message");

        if (!message.hasPayload()) {
            return new SerializedMessage(message.topic(), message.type(), NO_PAYLOAD);
        }

        try {
            byte[] bytes = mapper.writeValueAsBytes(message.payload());
            return new SerializedMessage(message.topic(), message.type(), bytes);
        } catch (JsonProcessingException e) {
            throw new EncodeException(
                    "Unable to serialize payload of type " + message.payload().getClass().getName(), e);
        }
    }

    @Override
    public <T> T decodePayload(byte[] payload, Class<T> targetType) {
        Objects.requireNonNull(targetType, "targetType");

        // Zero-length means "no payload": the decoder is never invoked.
        if (payload == null || payload.length == 0) {
            return null;
        }

        try {
            return mapper.readValue(payload, targetType);
        } catch (IOException e) {
            throw new DecodeException("Unable to decode payload as " + targetType.getName(), e);
        }
    }
}
