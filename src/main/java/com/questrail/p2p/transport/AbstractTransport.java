package com.questrail.p2p.transport;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.api.Message;
import com.questrail.p2p.codec.DecodeException;
import com.questrail.p2p.config.NodeConfig;
import com.questrail.p2p.model.Package;
import com.questrail.p2p.model.PackageMetadata;
import com.questrail.p2p.model.SerializedMessage;
import com.questrail.p2p.observability.DropReason;
import com.questrail.p2p.observability.NodeErrorEvent;
import com.questrail.p2p.observability.PackageDroppedEvent;
import com.questrail.p2p.observability.PackageTrafficEvent;
import com.questrail.p2p.observability.TransportObservabilityEvent;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * AbstractTransport
 * =============================================================================
 * Package pipeline shared by every transport binding. Subclasses only move
 * frames: they bind, write one frame to an {@link Address}, and feed every
 * received frame into {@link #onFrame(InetSocketAddress, byte[])}.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   Package
 *     → before-send hooks
 *         → PackageCodec.encode
 *             → size check (PackageTooLargeException, nothing written)
 *                 → write(to, frame)
 * </pre>
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 * <pre>
 *   frame
 *     → size check
 *         → PackageCodec.decode
 *             → PeerDirectory.resolve (advertised sender)
 *                 → after-receive hooks
 *                     → PackageProcessor
 *                         → reply, on the reply executor
 * </pre>
 *
 * <p>Invalid frames are dropped and reported. They never reach the processor
 * and never take the receive loop down.</p>
 */
public abstract class AbstractTransport implements Transport
{
    private final String name;
    private final int configuredAdvertisedPort;
    private final int maxPackageSize;

    protected final TransportContext context;

    private final AtomicReference<PackageProcessor> processor = new AtomicReference<>();

    /**
     * What {@link #onFrame(InetSocketAddress, byte[])} did with a frame.
     */
    protected enum FrameOutcome {
        /** Handed to the processor. */
        DISPATCHED,
        /** Oversized or undecodable; the bytes cannot be trusted. */
        MALFORMED,
        /** A well-formed package that was dropped (hook failure, not listening). */
        DISCARDED
    }

    protected AbstractTransport(String name, NodeConfig config, TransportContext context) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        this.context = Objects.requireNonNull(context, "context");
        this.configuredAdvertisedPort = config.advertisedPort();
        this.maxPackageSize = config.maxPackageSize();
    }

    // ---------------------------------------------------------------------
    // Binding-specific operations
    // ---------------------------------------------------------------------

    /**
     * Binds the local socket and starts the receive loop. Must not return
     * before {@link #localPort()} reports the bound port.
     *
     * @throws TransportException if binding fails
     */
    protected abstract void bind();

    /**
     * Writes one already-encoded frame without blocking on the network.
     *
     * @throws TransportException if the frame could not be handed to the network
     */
    protected abstract void write(Address to, byte[] frame);

    // ---------------------------------------------------------------------
    // Transport
    // ---------------------------------------------------------------------

    @Override
    public final void send(Address to, Package pkg) {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(pkg, "pkg");

        Package outbound = context.hooks().applyBeforeSend(pkg);
        byte[] frame = context.packageCodec().encode(outbound);
        if (frame.length > maxPackageSize) {
            throw new PackageTooLargeException(frame.length, maxPackageSize);
        }

        write(to, frame);
        context.sink().onTraffic(PackageTrafficEvent.of(PackageTrafficEvent.Direction.OUTBOUND, to, outbound, frame.length));
    }

    @Override
    public final void listen(PackageProcessor processor) {
        Objects.requireNonNull(processor, "processor");
        if (!this.processor.compareAndSet(null, processor)) {
            throw new IllegalStateException(name + " transport is already listening");
        }
        bind();
    }

    @Override
    public int advertisedPort() {
        return configuredAdvertisedPort > 0 ? configuredAdvertisedPort : localPort();
    }

    @Override
    public final int maxPackageSize() {
        return maxPackageSize;
    }

    protected final String name() {
        return name;
    }

    // ---------------------------------------------------------------------
    // Inbound pipeline
    // ---------------------------------------------------------------------

    /**
     * Runs one received frame through the inbound pipeline. Called on the
     * binding's receive loop; never throws.
     *
     * @param from transport-level source of the frame (possibly an ephemeral port)
     * @return what became of the frame; stream bindings close the connection on {@link FrameOutcome#MALFORMED}
     */
    protected final FrameOutcome onFrame(InetSocketAddress from, byte[] frame) {
        Address source = Address.of(from);

        if (frame.length > maxPackageSize) {
            drop(DropReason.OVERSIZED, source, frame.length + " bytes exceeds " + maxPackageSize, null);
            return FrameOutcome.MALFORMED;
        }

        final Package decoded;
        try {
            decoded = context.packageCodec().decode(frame);
        } catch (DecodeException e) {
            drop(DropReason.DECODE_FAILED, source, frame.length + " byte frame", e);
            return FrameOutcome.MALFORMED;
        }

        Address sender = context.peers().resolve(from, decoded.metadata().advertisedPort());
        context.sink().onTraffic(PackageTrafficEvent.of(PackageTrafficEvent.Direction.INBOUND, sender, decoded, frame.length));

        final Package pkg;
        try {
            pkg = context.hooks().applyAfterReceive(decoded);
        } catch (RuntimeException e) {
            drop(DropReason.HOOK_FAILED, sender, decoded.topic() + "/" + decoded.type(), e);
            return FrameOutcome.DISCARDED;
        }

        PackageProcessor p = processor.get();
        if (p == null) {
            drop(DropReason.NOT_LISTENING, sender, pkg.topic() + "/" + pkg.type(), null);
            return FrameOutcome.DISCARDED;
        }

        final CompletionStage<Optional<Message>> reply;
        try {
            reply = p.process(pkg, sender);
        } catch (RuntimeException e) {
            context.sink().onError(new NodeErrorEvent(Instant.now(),
                    "Processing " + pkg.topic() + "/" + pkg.type() + " from " + sender + " failed", e));
            return FrameOutcome.DISCARDED;
        }

        if (pkg.metadata().hasSession()) {
            int sessionId = pkg.metadata().sessionId();
            reply.whenCompleteAsync((message, failure) -> {
                if (failure != null) {
                    context.sink().onError(new NodeErrorEvent(Instant.now(),
                            "Processing " + pkg.topic() + "/" + pkg.type() + " from " + sender + " failed", failure));
                } else if (message.isPresent()) {
                    reply(sender, sessionId, message.get());
                }
            }, context.replyExecutor());
        }
        return FrameOutcome.DISPATCHED;
    }

    private void reply(Address to, int sessionId, Message message) {
        try {
            SerializedMessage serialized = context.payloadCodec().serialize(message);
            send(to, new Package(serialized, PackageMetadata.response(advertisedPort(), sessionId)));
        } catch (RuntimeException e) {
            context.sink().onError(new NodeErrorEvent(Instant.now(),
                    "Unable to reply to " + to + " for session " + sessionId, e));
        }
    }

    // ---------------------------------------------------------------------
    // Reporting helpers
    // ---------------------------------------------------------------------

    protected final void drop(DropReason reason, Address peer, String detail, Throwable cause) {
        context.sink().onPackageDropped(new PackageDroppedEvent(Instant.now(), reason, peer, detail, cause));
    }

    protected final void transportEvent(TransportObservabilityEvent.Kind kind, SocketAddress endpoint, Throwable cause) {
        context.sink().onTransportEvent(new TransportObservabilityEvent(Instant.now(), name, kind, endpoint, cause));
    }
}
