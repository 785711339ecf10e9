package com.questrail.p2p.transport;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.model.Package;

/**
 * Transport
 * =============================================================================
 * Moves whole {@link Package}s between nodes.
 *
 * <p>Implementations own their sockets and event loops. Everything above this
 * interface sees packages and logical {@link Address}es only; framing,
 * connections and ephemeral ports stay below it.</p>
 */
public interface Transport extends AutoCloseable
{
    /**
     * Runs before-send hooks, encodes, checks the size limit and writes.
     * Never waits for the network: failures that happen after the frame is
     * queued (connect refused or stalled, write error) go to the sink.
     *
     * @throws PackageTooLargeException if the encoded package exceeds {@link #maxPackageSize()}; nothing is written
     * @throws TransportException       if the package could not be handed to the network
     */
    void send(Address to, Package pkg);

    /**
     * Binds and starts receiving on the transport's own event loop. Returns
     * once the local socket is bound.
     *
     * @throws TransportException    if binding fails
     * @throws IllegalStateException if already listening
     */
    void listen(PackageProcessor processor);

    /**
     * Bound local port, or {@code 0} before {@link #listen(PackageProcessor)}.
     */
    int localPort();

    /**
     * Port written into outbound metadata: the configured advertised port, or
     * the bound port when none was configured.
     */
    int advertisedPort();

    int maxPackageSize();

    /**
     * Releases sockets and event loops. Idempotent.
     */
    @Override
    void close();
}
