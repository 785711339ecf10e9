package com.questrail.p2p.observability;

import com.questrail.p2p.api.Address;

import java.time.Instant;

/**
 * Record representing an inbound package that was discarded.
 *
 * @param peer   logical sender when known, otherwise the transport-level address; may be null
 * @param detail human-readable context (topic/type, session id, sizes)
 * @param cause  underlying failure; may be null
 */
public record PackageDroppedEvent(
    Instant timestamp,
    DropReason reason,
    Address peer,
    String detail,
    Throwable cause
) {
}
