package com.questrail.p2p.codec.impl;

import com.questrail.p2p.api.Message;
import com.questrail.p2p.codec.DecodeException;
import com.questrail.p2p.codec.EncodeException;
import com.questrail.p2p.model.SerializedMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JacksonPayloadCodecTest
{
    record Ping(long nonce, String note) {}

    record Peers(List<String> addresses) {}

    static final class Unwritable
    {
        public String getValue() {
            throw new IllegalStateException("not readable");
        }
    }

    private final JacksonPayloadCodec codec = new JacksonPayloadCodec();

    @Test
    void recordPayloadRoundTrips()
    {
        Message original = Message.of("KAD", "PING", new Ping(7L, "hi"));

        SerializedMessage wire = codec.serialize(original);
        assertEquals("KAD", wire.topic());
        assertEquals("PING", wire.type());
        assertTrue(wire.hasPayload());

        Message restored = codec.deserialize(wire, Ping.class);
        assertEquals(original, restored);
    }

    @Test
    void absentPayloadBecomesEmptyBytesAndBack()
    {
        SerializedMessage wire = codec.serialize(Message.of("KAD", "PING"));
        assertEquals(0, wire.payloadLength());

        Message restored = codec.deserialize(wire, Ping.class);
        assertFalse(restored.hasPayload());
        assertNull(restored.payload());
    }

    @Test
    void emptyBytesNeverReachTheDecoder()
    {
        // Integer cannot be read from an empty document; the codec must not try.
        assertNull(codec.decodePayload(new byte[0], Integer.class));
        assertNull(codec.decodePayload(null, Integer.class));
    }

    @Test
    void stringPayloadIsJsonText()
    {
        SerializedMessage wire = codec.serialize(Message.of("T", "X", "hello"));
        assertEquals("\"hello\"", new String(wire.payload(), StandardCharsets.UTF_8));
    }

    @Test
    void payloadCanBeReadAsACompatibleType()
    {
        SerializedMessage wire = codec.serialize(Message.of("T", "X", new Peers(List.of("10.0.0.1:1337"))));

        @SuppressWarnings("unchecked")
        Map<String, Object> generic = codec.decodePayload(wire.payload(), Map.class);
        assertEquals(List.of("10.0.0.1:1337"), generic.get("addresses"));
    }

    @Test
    void mismatchedTypeIsADecodeException()
    {
        SerializedMessage wire = codec.serialize(Message.of("T", "X", "not a number"));
        assertThrows(DecodeException.class, () -> codec.decodePayload(wire.payload(), Integer.class));
    }

    @Test
    void malformedJsonIsADecodeException()
    {
        byte[] broken = "{\"nonce\": 1,".getBytes(StandardCharsets.UTF_8);
        assertThrows(DecodeException.class, () -> codec.decodePayload(broken, Ping.class));
    }

    @Test
    void unserializablePayloadIsAnEncodeException()
    {
        EncodeException e = assertThrows(EncodeException.class,
                () -> codec.serialize(Message.of("T", "X", new Unwritable())));
        assertTrue(e.getMessage().contains(Unwritable.class.getName()));
    }
}
