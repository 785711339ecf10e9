package com.questrail.p2p.runtime;

import com.questrail.p2p.config.NodeConfig;
import com.questrail.p2p.transport.Transport;
import com.questrail.p2p.transport.TransportContext;
import com.questrail.p2p.transport.TransportFactory;
import com.questrail.p2p.transport.tcp.NettyTcpTransport;
import com.questrail.p2p.transport.udp.UdpTransport;
import com.questrail.p2p.transport.udp.netty.NettyUdpDatagramEndpoint;

/**
 * Netty-backed bindings, selected by {@link NodeConfig#transportKind()}.
 */
public final class DefaultTransportFactory implements TransportFactory
{
    @Override
    public Transport create(NodeConfig config, TransportContext context) {
        return switch (config.transportKind()) {
            case UDP -> new UdpTransport(config, context,
                    new NettyUdpDatagramEndpoint(config.bindAddress(), config.maxPackageSize()));
            case TCP -> new NettyTcpTransport(config, context);
        };
    }
}
