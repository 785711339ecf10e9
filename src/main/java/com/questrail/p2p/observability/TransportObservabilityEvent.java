package com.questrail.p2p.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a transport lifecycle event.
 *
 * @param transport short binding name, e.g. {@code "udp"} or {@code "tcp"}
 * @param endpoint  local address for UP/DOWN, remote address for connection events; may be null
 * @param cause     diagnostic cause; may be null
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    String transport,
    Kind kind,
    SocketAddress endpoint,
    Throwable cause
) {
    public enum Kind { UP, DOWN, CONNECTION_OPENED, CONNECTION_CLOSED }
}
