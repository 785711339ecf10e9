package com.questrail.p2p.model;

import java.util.Objects;

/**
 * Full unit placed on the wire: a serialized message plus the metadata needed
 * to route and correlate it. Encoded and compressed as one blob by
 * {@link com.questrail.p2p.codec.PackageCodec}.
 */
public record Package(SerializedMessage message, PackageMetadata metadata)
{
    public Package {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(metadata, "metadata");
    }

    public String topic() {
        return message.topic();
    }

    public String type() {
        return message.type();
    }

    public Package withMetadata(PackageMetadata newMetadata) {
        return new Package(message, newMetadata);
    }
}
