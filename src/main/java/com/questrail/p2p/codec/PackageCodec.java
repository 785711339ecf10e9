package com.questrail.p2p.codec;

import com.questrail.p2p.model.Package;

/**
 * PackageCodec
 * -----------------------------------------------------------------------------
 * Byte-level codec for whole {@link Package}s.
 *
 * <p>This interface is the boundary between raw transport bytes (one datagram,
 * or one length-delimited stream frame) and a structured {@link Package}.</p>
 *
 * <p>The codec is responsible only for:</p>
 * <ul>
 *   <li>Structural encoding of the package document</li>
 *   <li>Compression and decompression</li>
 *   <li>Detecting truncation or corruption</li>
 * </ul>
 *
 * <p>It does not frame (transports add length prefixes), does not enforce the
 * transport's maximum package size, and does not interpret topics, types or
 * sessions.</p>
 */
public interface PackageCodec
{
    /**
     * Encodes and compresses {@code pkg}.
     *
     * @throws EncodeException if the package cannot be written as a document
     */
    byte[] encode(Package pkg);

    /**
     * Decompresses and decodes exactly one package.
     *
     * @param bytes one complete compressed package
     * @return the decoded package
     * @throws DecodeException if the bytes are corrupt, truncated or structurally invalid
     */
    Package decode(byte[] bytes);
}
