/**
 * Envelope Codec
 * =============================================================================
 *
 * <p>The codec layer turns messages into bytes and back. It has two levels:</p>
 *
 * <pre>
 *   Message
 *        → PayloadCodec          (payload → bytes; topic/type untouched)
 *            → SerializedMessage
 *                + PackageMetadata
 *                    → PackageCodec   (structured document, then compression)
 *                        → byte[] handed to a transport
 * </pre>
 *
 * <h2>Wire format</h2>
 * <p>A package is a self-describing JSON document with field names preserved
 * (payload bytes appear base64-encoded), compressed with Deflate (zlib format). Receivers
 * always decompress before the structural decode. There is no in-band protocol
 * version; peers must run compatible codecs.</p>
 *
 * <h2>Failure model</h2>
 * <p>Every decode failure surfaces as {@link com.questrail.p2p.codec.DecodeException};
 * encode failures on the sending side surface as
 * {@link com.questrail.p2p.codec.EncodeException}.
 * Nothing in this layer substitutes default values for undecodable input.</p>
 */
package com.questrail.p2p.codec;
