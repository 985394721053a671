package com.questrail.lsnp.transport.udp.netty;

import com.questrail.lsnp.transport.DatagramEndpoint;
import com.questrail.lsnp.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * A pure transport adapter. It does not decode LSNP messages, track peers, or
 * schedule anything.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound payloads are copied into {@code byte[]} and
 * reference-counted buffers are released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Socket errors</h2>
 * UDP surfaces per-packet failures (ICMP port unreachable after sending to a
 * peer that went away, a route that is briefly missing) as channel exceptions.
 * {@link IOException}s are logged and the channel stays open; anything else
 * takes the endpoint down.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    /** Receive buffer sized to the largest UDP payload so no datagram is truncated. */
    private static final int RECEIVE_BUFFER_BYTES = 65_535;

    private final String name;
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * @param name        label used in logs ({@code "discovery"}, {@code "unicast"})
     * @param bindAddress local address; port 0 binds an ephemeral port
     * @param broadcast   enables {@code SO_BROADCAST}
     * @param reuseAddress enables {@code SO_REUSEADDR} so several nodes on one
     *                    host can share the discovery port
     */
    public NettyUdpDatagramEndpoint(String name,
                                    InetSocketAddress bindAddress,
                                    boolean broadcast,
                                    boolean reuseAddress)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, broadcast)
                .option(ChannelOption.SO_REUSEADDR, reuseAddress)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(RECEIVE_BUFFER_BYTES))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
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

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                log.debug("{} endpoint bound to {}", name, channel.localAddress());
                l.onTransportUp();
            }
            else {
                log.warn("{} endpoint failed to bind {}", name, bindAddress, future.cause());
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        group.shutdownGracefully();
        notifyDown(null);
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            log.debug("{} endpoint not up; discarding {} byte datagram to {}", name, payload.length, remote);
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.warn("{} endpoint failed to send to {}: {}", name, remote, future.cause().toString());
                    }
                });
    }

    @Override
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        if (ch == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((InetSocketAddress) ch.localAddress());
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
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    /**
     * Copies each Netty {@link DatagramPacket} payload into a {@code byte[]}
     * for the port listener.
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
            if (cause instanceof IOException) {
                log.warn("{} endpoint socket error (ignored): {}", name, cause.toString());
                return;
            }
            log.error("{} endpoint failed", name, cause);
            notifyDown(cause);
            ctx.close();
        }
    }
}
