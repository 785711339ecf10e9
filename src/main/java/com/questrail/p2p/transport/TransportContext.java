package com.questrail.p2p.transport;

import com.questrail.p2p.codec.PackageCodec;
import com.questrail.p2p.codec.PayloadCodec;
import com.questrail.p2p.identity.PeerDirectory;
import com.questrail.p2p.observability.NodeObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators a node hands to the transport it creates.
 *
 * @param replyExecutor executor replies are encoded and written on; never a transport event loop
 */
public record TransportContext(
        PackageCodec packageCodec,
        PayloadCodec payloadCodec,
        PeerDirectory peers,
        PackageHooks hooks,
        NodeObservabilitySink sink,
        Executor replyExecutor
) {
    public TransportContext {
        Objects.requireNonNull(packageCodec, "packageCodec");
        Objects.requireNonNull(payloadCodec, "payloadCodec");
        Objects.requireNonNull(peers, "peers");
        Objects.requireNonNull(hooks, "hooks");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(replyExecutor, "replyExecutor");
    }
}
