package com.questrail.p2p.transport.tcp;

import com.questrail.p2p.api.Address;
import com.questrail.p2p.config.NodeConfig;
import com.questrail.p2p.observability.DropReason;
import com.questrail.p2p.observability.NodeErrorEvent;
import com.questrail.p2p.observability.TransportObservabilityEvent;
import com.questrail.p2p.transport.AbstractTransport;
import com.questrail.p2p.transport.TransportContext;
import com.questrail.p2p.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpTransport
 * =============================================================================
 * Length-prefixed packages over TCP.
 *
 * <h2>Framing</h2>
 * Every package is preceded by a 4-byte big-endian length. Frames longer than
 * the configured maximum are rejected by the frame decoder before they are
 * buffered in full.
 *
 * <h2>Connections</h2>
 * Outbound connections are opened lazily on first send, cached by destination
 * {@link Address} and reused while open. Inbound connections are cached by the
 * peer's ephemeral address; a send to that peer's advertised address reuses
 * the inbound connection when the {@code PeerDirectory} knows the pair, which
 * is how replies travel back on the connection the request came in on.
 *
 * <p>Connecting never blocks the sender. The cache holds one connect future
 * per destination; frames written while it is pending are queued on it in
 * order and flushed once it succeeds. A failed connect is reported to the
 * sink, so a requester learns about it only through its own timeout. A
 * stalled peer never delays traffic to any other peer.</p>
 *
 * <h2>Failure isolation</h2>
 * Oversized frames, undecodable packages and I/O errors close the offending
 * connection only. The listening socket and every other connection keep
 * running.
 */
public final class NettyTcpTransport extends AbstractTransport
{
    private static final int LENGTH_FIELD_BYTES = 4;
    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap serverBootstrap;
    private final Bootstrap clientBootstrap;

    // Outbound entries may still be connecting; inbound entries are already-succeeded futures.
    private final Map<Address, ChannelFuture> channels = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Channel serverChannel;

    public NettyTcpTransport(NodeConfig config, TransportContext context) {
        super("tcp", config, context);
        this.bindAddress = config.bindAddress();

        this.bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("p2p-tcp-accept", true));
        this.workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("p2p-tcp-io", true));

        this.serverBootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new Initializer(true));

        this.clientBootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .handler(new Initializer(false));
    }

    @Override
    protected void bind() {
        if (closed.get()) {
            throw new IllegalStateException("Transport has been closed");
        }

        ChannelFuture f = serverBootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new TransportException("Unable to bind TCP listener to " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        transportEvent(TransportObservabilityEvent.Kind.UP, serverChannel.localAddress(), null);
    }

    @Override
    protected void write(Address to, byte[] frame) {
        ChannelFuture connection = connectionFor(to);
        connection.addListener((ChannelFutureListener) connected -> {
            if (!connected.isSuccess()) {
                context.sink().onError(new NodeErrorEvent(Instant.now(),
                        "Unable to connect to " + to, connected.cause()));
                return;
            }
            connected.channel().writeAndFlush(Unpooled.wrappedBuffer(frame)).addListener((ChannelFutureListener) written -> {
                if (!written.isSuccess()) {
                    context.sink().onError(new NodeErrorEvent(Instant.now(),
                            "TCP write to " + to + " failed", written.cause()));
                    written.channel().close();
                }
            });
        });
    }

    @Override
    public int localPort() {
        Channel ch = serverChannel;
        return ch == null ? 0 : ((InetSocketAddress) ch.localAddress()).getPort();
    }

    /**
     * Number of cached connections, inbound and outbound.
     */
    public int openConnections() {
        return (int) channels.values().stream()
                .filter(ChannelFuture::isSuccess)
                .map(ChannelFuture::channel)
                .distinct()
                .filter(Channel::isActive)
                .count();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        Channel server = serverChannel;
        if (server != null) {
            server.close().awaitUninterruptibly();
        }
        for (ChannelFuture connection : channels.values()) {
            // Closing a channel that is still connecting fails its connect future.
            connection.channel().close();
        }
        channels.clear();
        shutdownGroups();

        transportEvent(TransportObservabilityEvent.Kind.DOWN, server == null ? null : server.localAddress(), null);
    }

    // -------------------------------------------------------------------------
    // Connection cache
    // -------------------------------------------------------------------------

    private ChannelFuture connectionFor(Address to) {
        ChannelFuture cached = channels.get(to);
        if (usable(cached)) {
            return cached;
        }

        Optional<Address> ephemeral = context.peers().ephemeralFor(to);
        if (ephemeral.isPresent()) {
            ChannelFuture inbound = channels.get(ephemeral.get());
            if (usable(inbound)) {
                return inbound;
            }
        }

        // Locks only this destination's bin; connect() itself does not wait.
        return channels.compute(to, (address, existing) -> usable(existing) ? existing : connect(address));
    }

    // Pending connects count as usable: frames queue behind them.
    private static boolean usable(ChannelFuture connection) {
        if (connection == null) {
            return false;
        }
        if (!connection.isDone()) {
            return true;
        }
        return connection.isSuccess() && connection.channel().isActive();
    }

    private ChannelFuture connect(Address to) {
        if (closed.get()) {
            throw new TransportException("TCP transport is closed");
        }

        InetSocketAddress remote = to.toSocketAddress();
        if (remote.isUnresolved()) {
            throw new TransportException("Unable to resolve " + to);
        }

        return clientBootstrap.connect(remote);
    }

    private void forgetChannel(Channel ch) {
        channels.entrySet().removeIf(e -> e.getValue().channel() == ch);
    }

    private void shutdownGroups() {
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    // -------------------------------------------------------------------------
    // Pipeline
    // -------------------------------------------------------------------------

    private final class Initializer extends ChannelInitializer<SocketChannel>
    {
        private final boolean inbound;

        Initializer(boolean inbound) {
            this.inbound = inbound;
        }

        @Override
        protected void initChannel(SocketChannel ch) {
            ChannelPipeline p = ch.pipeline();
            p.addLast(new LengthFieldBasedFrameDecoder(
                    maxPackageSize() + LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
            p.addLast(new LengthFieldPrepender(LENGTH_FIELD_BYTES));
            p.addLast(new FrameHandler(inbound));
        }
    }

    /**
     * FrameHandler
     * -------------------------------------------------------------------------
     * Copies each complete frame out of its {@link ByteBuf} and runs it through
     * the shared inbound pipeline.
     */
    private final class FrameHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final boolean inbound;

        FrameHandler(boolean inbound) {
            this.inbound = inbound;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            InetSocketAddress remote = (InetSocketAddress) ctx.channel().remoteAddress();
            if (inbound) {
                channels.put(Address.of(remote), ctx.channel().newSucceededFuture());
            }
            transportEvent(TransportObservabilityEvent.Kind.CONNECTION_OPENED, remote, null);
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);

            InetSocketAddress remote = (InetSocketAddress) ctx.channel().remoteAddress();
            if (onFrame(remote, bytes) == FrameOutcome.MALFORMED) {
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            InetSocketAddress remote = (InetSocketAddress) ctx.channel().remoteAddress();
            forgetChannel(ctx.channel());
            if (inbound && remote != null) {
                context.peers().forget(Address.of(remote));
            }
            transportEvent(TransportObservabilityEvent.Kind.CONNECTION_CLOSED, remote, null);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            InetSocketAddress remote = (InetSocketAddress) ctx.channel().remoteAddress();
            Address peer = remote == null ? null : Address.of(remote);
            if (cause instanceof TooLongFrameException) {
                drop(DropReason.OVERSIZED, peer, cause.getMessage(), null);
            } else {
                context.sink().onError(new NodeErrorEvent(Instant.now(), "TCP connection with " + peer + " failed", cause));
            }
            ctx.close();
        }
    }
}
