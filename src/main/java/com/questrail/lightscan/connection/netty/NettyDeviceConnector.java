package com.questrail.lightscan.connection.netty;

import com.questrail.lightscan.connection.DeviceConnection;
import com.questrail.lightscan.connection.DeviceConnectionException;
import com.questrail.lightscan.connection.DeviceConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.ReferenceCountUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * NettyDeviceConnector
 * =============================================================================
 * Netty-backed {@link DeviceConnector} opening plain TCP streams.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package; callers see only
 * {@link DeviceConnection}.
 *
 * <h2>Lifecycle</h2>
 * The connector owns one event loop group shared by all connections it opens.
 * {@link #close()} closes the group and with it every open connection.
 */
public final class NettyDeviceConnector implements DeviceConnector, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyDeviceConnector.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyDeviceConnector()
    {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public NettyDeviceConnector(Duration connectTimeout)
    {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new DiscardInbound());
    }

    @Override
    public DeviceConnection connect(InetSocketAddress location)
    {
        Objects.requireNonNull(location, "location");

        ChannelFuture f = bootstrap.connect(location).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new DeviceConnectionException("Cannot connect to " + location, f.cause());
        }
        log.debug("Connected to {}", location);
        return new ChannelConnection(f.channel(), location);
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }

    /**
     * Command traffic is out of scope; anything a device pushes is released unread.
     */
    @ChannelHandler.Sharable
    private static final class DiscardInbound extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ReferenceCountUtil.release(msg);
        }
    }

    private static final class ChannelConnection implements DeviceConnection
    {
        private final Channel channel;
        private final InetSocketAddress remote;

        ChannelConnection(Channel channel, InetSocketAddress remote)
        {
            this.channel = channel;
            this.remote = remote;
        }

        @Override
        public InetSocketAddress remoteAddress()
        {
            return remote;
        }

        @Override
        public boolean isOpen()
        {
            return channel.isActive();
        }

        @Override
        public void close()
        {
            channel.close().awaitUninterruptibly();
        }
    }
}
