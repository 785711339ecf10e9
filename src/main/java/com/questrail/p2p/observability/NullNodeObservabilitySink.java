package com.questrail.p2p.observability;

/**
 * No-op implementation of NodeObservabilitySink.
 */
public final class NullNodeObservabilitySink implements NodeObservabilitySink {
    public static final NullNodeObservabilitySink INSTANCE = new NullNodeObservabilitySink();

    private NullNodeObservabilitySink() {}

    @Override
    public void onTraffic(PackageTrafficEvent event) {}

    @Override
    public void onPackageDropped(PackageDroppedEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(NodeErrorEvent event) {}
}
