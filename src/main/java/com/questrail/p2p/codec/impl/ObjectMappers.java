package com.questrail.p2p.codec.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson configuration for payloads and package documents.
 */
public final class ObjectMappers
{
    private static final ObjectMapper MAPPER = newMapper();

    private ObjectMappers() {}

    /**
     * The default mapper. Thread-safe once configured; callers must not reconfigure it.
     */
    public static ObjectMapper standard() {
        return MAPPER;
    }

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }
}
