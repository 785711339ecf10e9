package com.questrail.p2p.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NodeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jNodeObservabilitySink implements NodeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNodeObservabilitySink.class);

    @Override
    public void onTraffic(PackageTrafficEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("{} {}/{} session={} stage={} peer={} ({} bytes)",
                event.direction(),
                event.topic(),
                event.type(),
                event.sessionId(),
                event.stage(),
                event.peer(),
                event.sizeBytes());
        }
    }

    @Override
    public void onPackageDropped(PackageDroppedEvent event) {
        if (event.cause() != null) {
            log.warn("Dropped package from {}: {} ({})", event.peer(), event.reason(), event.detail(), event.cause());
        } else {
            log.warn("Dropped package from {}: {} ({})", event.peer(), event.reason(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        switch (event.kind()) {
            case UP, DOWN -> log.info("Transport {} {} on {}", event.transport(), event.kind(), event.endpoint());
            case CONNECTION_OPENED, CONNECTION_CLOSED ->
                log.debug("Transport {} {} {}", event.transport(), event.kind(), event.endpoint());
        }
    }

    @Override
    public void onError(NodeErrorEvent event) {
        log.error("Messaging error: {}", event.message(), event.cause());
    }
}
