package com.questrail.chat.protocol.transport.tcp.netty;

import com.questrail.chat.protocol.transport.StreamEndpoint;
import com.questrail.chat.protocol.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   LineBasedFrameDecoder (strips CRLF / LF) → StringDecoder (US-ASCII) → InboundHandler
 *   StringEncoder (US-ASCII) ← send(text)
 * </pre>
 *
 * <p>A line longer than {@link #MAX_LINE_LENGTH} is skipped up to its
 * terminator and reported through
 * {@link StreamEndpointListener#onDiscardedLine(String)}; reading continues.</p>
 *
 * <p>Like the datagram endpoint, this class knows nothing of the chat grammar
 * and keeps Netty types inside this package.</p>
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    /** Longest accepted inbound line: maximum content plus the longest frame prefix. */
    public static final int MAX_LINE_LENGTH = 60_000 + 256;

    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean downReported = new AtomicBoolean(false);

    private volatile StreamEndpointListener listener;
    private volatile Channel channel;

    public NettyTcpStreamEndpoint(InetSocketAddress remoteAddress, Duration connectTimeout)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
                        p.addLast(new StringDecoder(StandardCharsets.US_ASCII));
                        p.addLast(new StringEncoder(StandardCharsets.US_ASCII));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect()
    {
        StreamEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.connect(remoteAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                l.onConnected();
            }
            else {
                reportDown(future.cause());
            }
        });
    }

    @Override
    public CompletableFuture<Void> send(String text)
    {
        Objects.requireNonNull(text, "text");

        CompletableFuture<Void> done = new CompletableFuture<>();
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            done.completeExceptionally(new IllegalStateException("not connected"));
            return done;
        }

        ch.writeAndFlush(text).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                done.complete(null);
            }
            else {
                done.completeExceptionally(future.cause());
            }
        });
        return done;
    }

    @Override
    public CompletableFuture<Void> close()
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

    private void reportDown(Throwable cause)
    {
        StreamEndpointListener l = listener;
        if (l != null && downReported.compareAndSet(false, true)) {
            l.onDisconnected(cause);
        }
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before connect()");
        }
        return l;
    }

    /**
     * Forwards decoded lines to the listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<String>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onLine(line);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reportDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // The line decoder has already skipped past the oversize line
            if (cause instanceof TooLongFrameException) {
                StreamEndpointListener l = listener;
                if (l != null) {
                    l.onDiscardedLine(cause.getMessage());
                }
                return;
            }
            reportDown(cause);
            ctx.close();
        }
    }
}
