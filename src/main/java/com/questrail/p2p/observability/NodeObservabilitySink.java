package com.questrail.p2p.observability;

/**
 * Main interface for receiving messaging-engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from transport event loops, handler threads and caller
 * threads alike. Implementations must be thread-safe and must not block.</p>
 */
public interface NodeObservabilitySink {
    /**
     * Called for every package written to or read from a transport.
     * @param event the traffic details
     */
    void onTraffic(PackageTrafficEvent event);

    /**
     * Called when an inbound package (or a response for it) is discarded.
     * @param event why, and from whom
     */
    void onPackageDropped(PackageDroppedEvent event);

    /**
     * Called when a transport-level event occurs (bind, connection open/close).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when an error occurs that is not tied to a single inbound package,
     * such as a failed fire-and-forget delivery.
     * @param event the error event
     */
    void onError(NodeErrorEvent event);
}
