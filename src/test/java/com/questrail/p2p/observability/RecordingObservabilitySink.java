package com.questrail.p2p.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements NodeObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTraffic(PackageTrafficEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPackageDropped(PackageDroppedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(NodeErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<PackageDroppedEvent> getDrops() {
        return events.stream()
            .filter(e -> e instanceof PackageDroppedEvent)
            .map(e -> (PackageDroppedEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<NodeErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof NodeErrorEvent)
            .map(e -> (NodeErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<PackageTrafficEvent> getTraffic() {
        return events.stream()
            .filter(e -> e instanceof PackageTrafficEvent)
            .map(e -> (PackageTrafficEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasDrop(DropReason reason) {
        return getDrops().stream().anyMatch(d -> d.reason() == reason);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
