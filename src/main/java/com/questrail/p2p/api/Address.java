package com.questrail.p2p.api;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Logical endpoint of a peer: the host it is reachable on and the port it
 * <em>advertises</em> as its listening port.
 *
 * <h2>Advertised vs. ephemeral ports</h2>
 * <p>
 * A package may arrive from an ephemeral source port (for instance the local
 * side of an outbound TCP connection). Everything above the transport sees
 * {@code Address} values carrying the advertised port instead; the mapping
 * between both is kept by {@code PeerDirectory}.
 * </p>
 *
 * <p>
 * Hosts are compared textually. No DNS resolution happens here, so
 * {@code localhost} and {@code 127.0.0.1} are distinct addresses.
 * </p>
 */
public record Address(String host, int port)
{
    public Address {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be in range 0-65535 (was " + port + ")");
        }
    }

    /**
     * Builds an address from the textual IP of a transport-level socket address.
     */
    public static Address of(InetSocketAddress socketAddress) {
        Objects.requireNonNull(socketAddress, "socketAddress");
        return new Address(hostOf(socketAddress), socketAddress.getPort());
    }

    /**
     * Builds an address from the IP of {@code socketAddress} combined with a different port.
     */
    public static Address of(InetSocketAddress socketAddress, int port) {
        Objects.requireNonNull(socketAddress, "socketAddress");
        return new Address(hostOf(socketAddress), port);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }

    private static String hostOf(InetSocketAddress socketAddress) {
        return socketAddress.getAddress() != null
                ? socketAddress.getAddress().getHostAddress()
                : socketAddress.getHostString();
    }
}
