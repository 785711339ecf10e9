package com.questrail.p2p.codec.impl;

import com.questrail.p2p.codec.DecodeException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class DeflateCompressionTest
{
    @Test
    void emptyInputSurvivesCompression()
    {
        byte[] compressed = DeflateCompression.compress(new byte[0]);
        assertTrue(compressed.length > 0, "a zlib stream always has a header");
        assertArrayEquals(new byte[0], DeflateCompression.decompress(compressed, 16));
    }

    @Test
    void repetitiveTextShrinks()
    {
        byte[] text = "PING PING PING PING PING PING PING PING PING PING PING PING".getBytes(StandardCharsets.UTF_8);
        byte[] compressed = DeflateCompression.compress(text);

        assertTrue(compressed.length < text.length);
        assertArrayEquals(text, DeflateCompression.decompress(compressed, 1024));
    }

    @Test
    void incompressibleInputLargerThanOneChunkRoundTrips()
    {
        byte[] noise = new byte[10_000];
        new Random(42).nextBytes(noise);

        byte[] restored = DeflateCompression.decompress(DeflateCompression.compress(noise), noise.length);
        assertArrayEquals(noise, restored);
    }

    @Test
    void inflatingBeyondTheBoundIsRejected()
    {
        byte[] zeros = new byte[64 * 1024];
        byte[] compressed = DeflateCompression.compress(zeros);

        assertTrue(compressed.length < zeros.length / 16);
        DecodeException e = assertThrows(DecodeException.class,
                () -> DeflateCompression.decompress(compressed, 4096));
        assertTrue(e.getMessage().contains("4096"));
    }

    @Test
    void truncatedStreamIsRejected()
    {
        byte[] compressed = DeflateCompression.compress("hello, peer".getBytes(StandardCharsets.UTF_8));
        byte[] truncated = Arrays.copyOf(compressed, compressed.length - 3);

        assertThrows(DecodeException.class, () -> DeflateCompression.decompress(truncated, 1024));
    }

    @Test
    void garbageIsRejected()
    {
        byte[] garbage = { 0x13, 0x37, 0x00, 0x42, (byte) 0xFF, 0x10 };
        assertThrows(DecodeException.class, () -> DeflateCompression.decompress(garbage, 1024));
    }

    @Test
    void trailingBytesAreRejected()
    {
        byte[] compressed = DeflateCompression.compress("abc".getBytes(StandardCharsets.UTF_8));
        byte[] padded = Arrays.copyOf(compressed, compressed.length + 2);

        assertThrows(DecodeException.class, () -> DeflateCompression.decompress(padded, 1024));
    }
}
