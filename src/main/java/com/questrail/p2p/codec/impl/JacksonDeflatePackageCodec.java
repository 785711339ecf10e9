package com.questrail.p2p.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.p2p.codec.DecodeException;
import com.questrail.p2p.codec.EncodeException;
import com.questrail.p2p.codec.PackageCodec;
import com.questrail.p2p.model.Package;

import java.io.IOException;
import java.util.Objects;

/**
 * JacksonDeflatePackageCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PackageCodec}.
 *
 * <p>Encoding performs, in order:</p>
 * <ol>
 *   <li>Structural encoding of the package as a JSON document</li>
 *   <li>Compression ({@link DeflateCompression})</li>
 * </ol>
 *
 * <p>Decoding reverses the steps. Decompression is bounded by
 * {@code maxInflatedSize}; anything that fails at either step is reported as
 * a {@link DecodeException}. Encoding failures raise {@link EncodeException}.</p>
 */
public final class JacksonDeflatePackageCodec implements PackageCodec
{
    /** Default bound on the inflated size of one package (1 MiB). */
    public static final int DEFAULT_MAX_INFLATED_SIZE = 1024 * 1024;

    private final ObjectMapper mapper;
    private final int maxInflatedSize;

    public JacksonDeflatePackageCodec() {
        this(ObjectMappers.standard(), DEFAULT_MAX_INFLATED_SIZE);
    }

    public JacksonDeflatePackageCodec(int maxInflatedSize) {
        this(ObjectMappers.standard(), maxInflatedSize);
    }

    public JacksonDeflatePackageCodec(ObjectMapper mapper, int maxInflatedSize) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        if (maxInflatedSize <= 0) {
            throw new IllegalArgumentException("maxInflatedSize must be > 0");
        }
        this.maxInflatedSize = maxInflatedSize;
    }

    @Override
    public byte[] encode(Package pkg) {
        Objects.requireNonNull(pkg, "pkg");

        final byte[] document;
        try {
            document = mapper.writeValueAsBytes(pkg);
        } catch (JsonProcessingException e) {
            throw new EncodeException("Unable to encode package " + pkg.message(), e);
        }
        return DeflateCompression.compress(document);
    }

    @Override
    public Package decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("Empty package");
        }

        // 1) Decompress (bounded)
        final byte[] document = DeflateCompression.decompress(bytes, maxInflatedSize);

        // 2) Structural decode
        final Package pkg;
        try {
            pkg = mapper.readValue(document, Package.class);
        } catch (IOException e) {
            throw new DecodeException("Malformed package document", e);
        }

        if (pkg == null || pkg.message() == null || pkg.metadata() == null) {
            throw new DecodeException("Package document is missing message or metadata");
        }
        return pkg;
    }
}
