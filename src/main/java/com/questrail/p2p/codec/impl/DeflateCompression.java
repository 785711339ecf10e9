package com.questrail.p2p.codec.impl;

import com.questrail.p2p.codec.DecodeException;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * DeflateCompression
 * -----------------------------------------------------------------------------
 * Fixed compression pass applied to every encoded package.
 *
 * <p>Uses {@link Deflater#BEST_SPEED}: packages are small and latency matters
 * more than ratio. Output is in zlib format.</p>
 *
 * <p>Decompression is bounded. A frame whose inflated form exceeds the limit is
 * rejected instead of being expanded into memory.</p>
 */
public final class DeflateCompression
{
    private static final int CHUNK = 1024;

    private DeflateCompression() {}

    public static byte[] compress(byte[] data) {
        Deflater deflater = new Deflater(Deflater.BEST_SPEED);
        try {
            deflater.setInput(data);
            deflater.finish();

            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(CHUNK, data.length / 2));
            byte[] buffer = new byte[CHUNK];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * Inflates {@code data}, which must be exactly one complete zlib stream.
     *
     * @param maxInflatedSize upper bound on the inflated length
     * @throws DecodeException if the stream is corrupt, truncated, or inflates beyond the bound
     */
    public static byte[] decompress(byte[] data, int maxInflatedSize) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);

            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(CHUNK, data.length * 4));
            byte[] buffer = new byte[CHUNK];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0) {
                    if (inflater.needsDictionary()) {
                        throw new DecodeException("Compressed package requires a preset dictionary");
                    }
                    if (inflater.needsInput()) {
                        throw new DecodeException("Compressed package is truncated");
                    }
                }
                if (out.size() + n > maxInflatedSize) {
                    throw new DecodeException("Package inflates beyond " + maxInflatedSize + " bytes");
                }
                out.write(buffer, 0, n);
            }
            if (inflater.getRemaining() > 0) {
                throw new DecodeException("Trailing bytes after compressed package");
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new DecodeException("Corrupt compressed package", e);
        } finally {
            inflater.end();
        }
    }
}
