package com.questrail.p2p.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint} implementation.
 *
 * <p>It contains no package semantics; it only stores outbound datagrams and
 * allows tests to inject inbound ones.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    public record Sent(SocketAddress remote, byte[] payload) {}

    private final InetSocketAddress local;
    private DatagramEndpointListener listener;
    private final List<Sent> sent = new ArrayList<>();
    private volatile boolean started;

    public FakeDatagramEndpoint(int localPort) {
        this.local = new InetSocketAddress("127.0.0.1", localPort);
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        if (listener != null) {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        started = false;
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public synchronized void send(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (!started) {
            throw new TransportException("not started");
        }
        sent.add(new Sent(remote, payload));
    }

    @Override
    public InetSocketAddress localAddress() {
        return started ? local : null;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onDatagram(remote, payload);
    }

    public synchronized List<Sent> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized void clear() {
        sent.clear();
    }
}
