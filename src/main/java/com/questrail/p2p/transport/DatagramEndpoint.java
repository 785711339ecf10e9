package com.questrail.p2p.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>The endpoint moves raw datagrams only. The owning transport is
 * responsible for:</p>
 * <ul>
 *   <li>decoding inbound datagrams into packages</li>
 *   <li>encoding and size-checking outbound packages</li>
 *   <li>resolving senders and dispatching</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Bind the endpoint and begin receiving datagrams. Returns once bound.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once.</p>
     *
     * @throws TransportException if the socket cannot be bound
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources. Idempotent.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once.</p>
     */
    void stop();

    /**
     * Send one datagram. Completion is asynchronous; failures that happen
     * after this call returns are reported through
     * {@link DatagramEndpointListener#onError(SocketAddress, Throwable)}.
     *
     * @throws TransportException if the endpoint is not started
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Bound local address, or {@code null} before {@link #start()}.
     */
    InetSocketAddress localAddress();

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
