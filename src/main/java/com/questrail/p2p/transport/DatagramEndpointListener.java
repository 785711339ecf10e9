package com.questrail.p2p.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Inbound callbacks are delivered serially by the implementation (Netty
 * endpoints deliver them on the channel's event loop).</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called once when the endpoint is bound and receiving.
     */
    void onTransportUp();

    /**
     * Called when the endpoint becomes unusable.
     *
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received.
     *
     * <p>The payload is delivered exactly as received, copied out of any
     * framework buffer. It is one complete datagram; no streaming assumptions
     * are permitted at this boundary.</p>
     *
     * @param remote remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);

    /**
     * Called for a failed write or a non-fatal socket error. The endpoint
     * stays up.
     *
     * @param remote peer involved, if known; may be {@code null}
     */
    void onError(SocketAddress remote, Throwable cause);
}
