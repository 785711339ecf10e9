package com.questrail.p2p.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the messaging stack.
 */
public record NodeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
