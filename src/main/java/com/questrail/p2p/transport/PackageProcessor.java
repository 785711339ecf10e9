package com.questrail.p2p.transport;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.api.Message;
import com.questrail.p2p.model.Package;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Consumer of decoded inbound packages, installed by {@link Transport#listen(PackageProcessor)}.
 *
 * <p>Called on the transport's receive loop; implementations must hand off
 * any real work and return promptly. A present reply is sent back by the
 * transport to {@code sender}, correlated with the inbound session.</p>
 */
@FunctionalInterface
public interface PackageProcessor
{
    CompletionStage<Optional<Message>> process(Package pkg, Address sender);
}
