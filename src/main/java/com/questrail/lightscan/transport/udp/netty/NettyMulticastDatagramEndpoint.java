package com.questrail.lightscan.transport.udp.netty;

import com.questrail.lightscan.config.ConfigurationException;
import com.questrail.lightscan.config.DiscoveryConfig;
import com.questrail.lightscan.transport.DatagramEndpoint;
import com.questrail.lightscan.transport.InboundDatagram;
import com.questrail.lightscan.transport.TransportSendException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyMulticastDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port, bound to the
 * wildcard address and joined to an IPv4 multicast group.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse advertisements</li>
 *   <li>Decode devices</li>
 *   <li>Schedule queries or timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Threading</h2>
 * A dedicated single-thread event loop reads the socket and appends a copy of
 * every payload to a lock-free queue. {@link #poll()} only dequeues, so the
 * session thread never waits on the socket. At most {@link #MAX_PENDING}
 * datagrams are held; further arrivals are dropped until the queue drains.
 *
 * <p>Receiving continues between sessions. A datagram that arrives after one
 * session's deadline stays queued and is polled by the next session on the
 * same endpoint.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #open(DiscoveryConfig)} binds the UDP socket and joins the group.
 * - {@link #close()} closes the channel and shuts down the event loop group.
 */
public final class NettyMulticastDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyMulticastDatagramEndpoint.class);

    /** Upper bound on datagrams received but not yet polled. */
    static final int MAX_PENDING = 1024;

    private static final String WILDCARD = "0.0.0.0";

    private final EventLoopGroup group;
    private final DatagramChannel channel;

    private final Queue<InboundDatagram> inbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    private NettyMulticastDatagramEndpoint(EventLoopGroup group, DatagramChannel channel)
    {
        this.group = group;
        this.channel = channel;
    }

    /**
     * Binds {@code 0.0.0.0:localPort}, joins the configured group and starts receiving.
     *
     * @throws ConfigurationException if binding or joining fails
     */
    public static NettyMulticastDatagramEndpoint open(DiscoveryConfig config)
    {
        Objects.requireNonNull(config, "config");

        final NetworkInterface iface = MulticastInterfaces.resolve(config.networkInterface());
        final EventLoopGroup group = new NioEventLoopGroup(1);
        try {
            return bindAndJoin(config, iface, group);
        } catch (RuntimeException e) {
            group.shutdownGracefully();
            throw e;
        }
    }

    private static NettyMulticastDatagramEndpoint bindAndJoin(DiscoveryConfig config,
                                                              NetworkInterface iface,
                                                              EventLoopGroup group)
    {
        final Inbound handler = new Inbound();

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channelFactory((io.netty.channel.ChannelFactory<NioDatagramChannel>)
                        () -> new NioDatagramChannel(InternetProtocolFamily.IPv4))
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.IP_MULTICAST_IF, iface)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(config.receiveBufferSize()))
                .handler(handler);

        // We don't know the addresses of the lights, so listen on all of them.
        final ChannelFuture bind = bootstrap.bind(new InetSocketAddress(WILDCARD, config.localPort()))
                .awaitUninterruptibly();
        if (!bind.isSuccess()) {
            throw new ConfigurationException("Cannot bind UDP port " + config.localPort(), bind.cause());
        }

        final DatagramChannel channel = (DatagramChannel) bind.channel();
        final ChannelFuture join = channel.joinGroup(config.multicastGroup(), iface).awaitUninterruptibly();
        if (!join.isSuccess()) {
            channel.close().awaitUninterruptibly();
            throw new ConfigurationException(
                    "Cannot join multicast group " + config.multicastGroup() + " on " + iface.getName(),
                    join.cause());
        }

        NettyMulticastDatagramEndpoint endpoint = new NettyMulticastDatagramEndpoint(group, channel);
        handler.attach(endpoint);
        log.debug("Joined {} on {} via {}", config.multicastGroup(), channel.localAddress(), iface.getName());
        return endpoint;
    }

    /**
     * Local address the socket is bound to.
     */
    public InetSocketAddress localAddress()
    {
        return (InetSocketAddress) channel.localAddress();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        if (closed.get()) {
            throw new TransportSendException("Endpoint is closed");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        DatagramPacket pkt = new DatagramPacket(buf, (InetSocketAddress) remote);
        ChannelFuture write = channel.writeAndFlush(pkt).awaitUninterruptibly();
        if (!write.isSuccess()) {
            throw new TransportSendException("Failed to send datagram to " + remote, write.cause());
        }
    }

    @Override
    public Optional<InboundDatagram> poll()
    {
        InboundDatagram next = inbound.poll();
        if (next != null) {
            pending.decrementAndGet();
        }
        return Optional.ofNullable(next);
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close().awaitUninterruptibly();
        group.shutdownGracefully();
    }

    private void enqueue(InboundDatagram datagram)
    {
        if (pending.incrementAndGet() > MAX_PENDING) {
            pending.decrementAndGet();
            log.debug("Inbound queue full, dropping datagram from {}", datagram.sender());
            return;
        }
        inbound.add(datagram);
    }

    /**
     * Inbound
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and queues raw payload bytes.
     *
     * <p>Created before the endpoint exists (the bootstrap needs it), then
     * attached once binding succeeds. Packets arriving before attachment are
     * dropped.</p>
     */
    @ChannelHandler.Sharable
    private static final class Inbound extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private volatile NettyMulticastDatagramEndpoint endpoint;

        void attach(NettyMulticastDatagramEndpoint endpoint)
        {
            this.endpoint = endpoint;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            NettyMulticastDatagramEndpoint e = endpoint;
            if (e == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            e.enqueue(new InboundDatagram(packet.sender(), bytes));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Per-datagram receive errors (e.g. ICMP port unreachable) are not
            // fatal to the socket; keep the channel open.
            log.debug("Receive error on {}", ctx.channel().localAddress(), cause);
        }
    }
}
