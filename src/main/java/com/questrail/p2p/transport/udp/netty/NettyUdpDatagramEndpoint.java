package com.questrail.p2p.transport.udp.netty;

import com.questrail.p2p.transport.DatagramEndpoint;
import com.questrail.p2p.transport.DatagramEndpointListener;
import com.questrail.p2p.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode packages</li>
 *   <li>Enforce the package size limit (it only makes oversize detectable)</li>
 *   <li>Run handlers or schedule retries</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and emitted to the port
 * listener. All reference-counted buffers are released internally.</p>
 *
 * <h2>Oversized datagrams</h2>
 * The receive buffer is one byte larger than the largest datagram the
 * transport accepts. A datagram that fills it was either oversized or
 * truncated by the socket, and the transport's size check drops it.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket synchronously and begins receiving.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean up = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * @param bindAddress        local address to bind; port 0 picks a free port
     * @param maxDatagramSize    largest datagram the owner accepts
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxDatagramSize <= 0) {
            throw new IllegalArgumentException("maxDatagramSize must be > 0");
        }

        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("p2p-udp", true));
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(maxDatagramSize + 1))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();
        if (stopped.get()) {
            throw new IllegalStateException("Endpoint has been stopped");
        }

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new TransportException("Unable to bind UDP endpoint to " + bindAddress, f.cause());
        }

        channel = f.channel();
        if (up.compareAndSet(false, true)) {
            l.onTransportUp();
        }
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        notifyDown(null);
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new TransportException("UDP endpoint is not started");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        DatagramPacket pkt = new DatagramPacket(buf, (InetSocketAddress) remote);
        ch.writeAndFlush(pkt).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                DatagramEndpointListener l = listener;
                if (l != null) {
                    l.onError(remote, future.cause());
                }
            }
        });
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = channel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyDown(Throwable cause)
    {
        DatagramEndpointListener l = listener;
        if (l != null && up.compareAndSet(true, false)) {
            l.onTransportDown(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // A UDP socket error (e.g. ICMP port unreachable) concerns one
            // datagram; the channel keeps serving everyone else.
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onError(null, cause);
            }
        }
    }
}
