package com.questrail.p2p.transport.udp;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.config.NodeConfig;
import com.questrail.p2p.observability.NodeErrorEvent;
import com.questrail.p2p.observability.TransportObservabilityEvent;
import com.questrail.p2p.transport.AbstractTransport;
import com.questrail.p2p.transport.DatagramEndpoint;
import com.questrail.p2p.transport.DatagramEndpointListener;
import com.questrail.p2p.transport.TransportContext;
import com.questrail.p2p.transport.TransportException;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * UdpTransport
 * =============================================================================
 * One package per datagram, over a {@link DatagramEndpoint}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint.onDatagram
 *        → AbstractTransport.onFrame (size check, decode, resolve, hooks)
 *            → PackageProcessor
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   Package
 *        → AbstractTransport.send (hooks, encode, size check)
 *            → DatagramEndpoint.send(...)
 * </pre>
 *
 * <p>UDP gives no delivery guarantee. A datagram that is lost, or rejected by
 * the peer, surfaces to a requester only as a response timeout.</p>
 */
public final class UdpTransport extends AbstractTransport implements DatagramEndpointListener
{
    private final DatagramEndpoint endpoint;

    public UdpTransport(NodeConfig config, TransportContext context, DatagramEndpoint endpoint) {
        super("udp", config, context);
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");

        // The endpoint is the raw I/O surface; this class is the translation layer.
        this.endpoint.setListener(this);
    }

    @Override
    protected void bind() {
        endpoint.start();
    }

    @Override
    protected void write(Address to, byte[] frame) {
        InetSocketAddress remote = to.toSocketAddress();
        if (remote.isUnresolved()) {
            throw new TransportException("Unable to resolve " + to);
        }
        endpoint.send(remote, frame);
    }

    @Override
    public int localPort() {
        InetSocketAddress local = endpoint.localAddress();
        return local == null ? 0 : local.getPort();
    }

    @Override
    public void close() {
        endpoint.stop();
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportEvent(TransportObservabilityEvent.Kind.UP, endpoint.localAddress(), null);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportEvent(TransportObservabilityEvent.Kind.DOWN, endpoint.localAddress(), cause);
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        onFrame((InetSocketAddress) remote, payload);
    }

    @Override
    public void onError(SocketAddress remote, Throwable cause) {
        context.sink().onError(new NodeErrorEvent(Instant.now(),
                "UDP error" + (remote == null ? "" : " with " + remote), cause));
    }
}
