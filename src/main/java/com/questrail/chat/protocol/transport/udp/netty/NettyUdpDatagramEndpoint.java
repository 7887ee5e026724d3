package com.questrail.chat.protocol.transport.udp.netty;

import com.questrail.chat.protocol.transport.DatagramEndpoint;
import com.questrail.chat.protocol.transport.DatagramEndpointListener;

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
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural role</h2>
 * A pure transport adapter. It does not decode frames, acknowledge, retry or
 * choose destinations; it moves payloads between a UDP socket and the listener.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound payloads are copied into {@code byte[]} and all
 * reference-counted buffers are released internally.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds the socket (an ephemeral local port by default).
 * {@link #stop()} closes the channel and shuts the event loop down; the
 * listener is told the transport is down exactly once.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean downReported = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * Endpoint bound to an ephemeral port on the wildcard address.
     */
    public NettyUdpDatagramEndpoint()
    {
        this(new InetSocketAddress(0));
    }

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
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
                l.onTransportUp();
            }
            else {
                reportDown(future.cause());
            }
        });
    }

    @Override
    public CompletableFuture<Void> stop()
    {
        CompletableFuture<Void> done = new CompletableFuture<>();

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully(0, 500, TimeUnit.MILLISECONDS)
                .addListener(f -> done.complete(null));

        reportDown(null);
        return done;
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote));
    }

    /**
     * Locally bound address, once started.
     */
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return ch == null ? null : ch.localAddress();
    }

    private void reportDown(Throwable cause)
    {
        DatagramEndpointListener l = listener;
        if (l != null && downReported.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * Copies each {@link DatagramPacket} payload out of Netty and hands it to the listener.
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
            reportDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            reportDown(cause);
            ctx.close();
        }
    }
}
