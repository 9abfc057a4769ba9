package com.questrail.oob.transport.tcp.netty;

import com.questrail.oob.api.OobToken;
import com.questrail.oob.codec.OobFraming;
import com.questrail.oob.codec.token.OobTokenCodec;
import com.questrail.oob.codec.token.OobWireFormat;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldPrepender;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyOobTokenSender
 * =============================================================================
 * Peer side of the out-of-band channel: connects to a listening channel and
 * writes exactly one framed token.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>transport adapter</strong>. Token encoding stays in
 * the {@link OobTokenCodec} of the configured wire format; framing is done by
 * Netty's {@link LengthFieldPrepender} configured with the
 * {@link OobFraming} constants (4-byte unsigned little-endian prefix).
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Callers see only
 * {@link InetSocketAddress}, {@link OobToken} and {@link CompletableFuture}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #send(InetSocketAddress, OobToken)} opens one connection per token
 *   and closes it once the frame is flushed.
 * - {@link #close()} shuts down the event loop group.
 */
public final class NettyOobTokenSender implements AutoCloseable
{
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final OobTokenCodec codec;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyOobTokenSender(OobWireFormat wireFormat)
    {
        this(wireFormat, DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * We use a dedicated single-threaded {@link NioEventLoopGroup}: a sender
     * writes one small frame per pairing attempt.
     */
    public NettyOobTokenSender(OobWireFormat wireFormat, Duration connectTimeout)
    {
        this.codec = Objects.requireNonNull(wireFormat, "wireFormat").codec();
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(connectTimeout.toMillis(), Integer.MAX_VALUE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new LengthFieldPrepender(
                                OobFraming.LENGTH_PREFIX_ORDER,
                                OobFraming.LENGTH_PREFIX_BYTES,
                                0,
                                false));
                    }
                });
    }

    /**
     * Connect to {@code remote}, write {@code token} as a single frame, then close.
     *
     * @return completes once the frame has been flushed, or exceptionally if
     *         the connection or the write fails
     * @throws IllegalArgumentException if the wire format cannot carry the token
     */
    public CompletableFuture<Void> send(InetSocketAddress remote, OobToken token)
    {
        Objects.requireNonNull(remote, "remote");
        byte[] payload = codec.encode(Objects.requireNonNull(token, "token"));

        CompletableFuture<Void> result = new CompletableFuture<>();
        bootstrap.connect(remote).addListener((ChannelFutureListener) connect -> {
            if (!connect.isSuccess()) {
                result.completeExceptionally(connect.cause());
                return;
            }

            Channel ch = connect.channel();
            ch.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener((ChannelFutureListener) write -> {
                if (write.isSuccess()) {
                    result.complete(null);
                }
                else {
                    result.completeExceptionally(write.cause());
                }
                ch.close();
            });
        });
        return result;
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }
}
