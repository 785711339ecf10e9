package com.questrail.p2p.transport;

import com.questrail.p2p.config.NodeConfig;

/**
 * Creates the transport binding for a node. Tests substitute fakes here.
 */
@FunctionalInterface
public interface TransportFactory
{
    Transport create(NodeConfig config, TransportContext context);
}
