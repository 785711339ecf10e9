package com.questrail.p2p.observability;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.model.Package;

import java.time.Instant;

/**
 * Record representing one package crossing a transport.
 */
public record PackageTrafficEvent(
    Instant timestamp,
    Direction direction,
    Address peer,
    String topic,
    String type,
    Integer sessionId,
    String stage,
    int sizeBytes
) {
    public enum Direction { INBOUND, OUTBOUND }

    public static PackageTrafficEvent of(Direction direction, Address peer, Package pkg, int sizeBytes) {
        return new PackageTrafficEvent(
            Instant.now(),
            direction,
            peer,
            pkg.topic(),
            pkg.type(),
            pkg.metadata().sessionId(),
            pkg.metadata().stage().name(),
            sizeBytes
        );
    }
}
