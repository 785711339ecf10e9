package com.questrail.p2p.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SerializedMessageTest
{
    @Test
    void equalityComparesPayloadContent()
    {
        SerializedMessage a = new SerializedMessage("T", "X", new byte[] { 1, 2, 3 });
        SerializedMessage b = new SerializedMessage("T", "X", new byte[] { 1, 2, 3 });
        SerializedMessage c = new SerializedMessage("T", "X", new byte[] { 1, 2, 4 });

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void payloadIsDefensivelyCopied()
    {
        byte[] bytes = { 1, 2, 3 };
        SerializedMessage message = new SerializedMessage("T", "X", bytes);

        bytes[0] = 99;
        message.payload()[1] = 99;

        assertArrayEquals(new byte[] { 1, 2, 3 }, message.payload());
    }

    @Test
    void nullPayloadMeansNoPayload()
    {
        SerializedMessage message = new SerializedMessage("T", "X", null);
        assertFalse(message.hasPayload());
        assertEquals(0, message.payloadLength());
    }
}
