package com.questrail.lightscan.discovery;

import com.questrail.lightscan.codec.ParsedResponse;
import com.questrail.lightscan.codec.ResponseParseException;
import com.questrail.lightscan.codec.ResponseParser;
import com.questrail.lightscan.codec.impl.DefaultResponseParser;
import com.questrail.lightscan.config.ConfigurationException;
import com.questrail.lightscan.config.DiscoveryConfig;
import com.questrail.lightscan.internal.collect.DedupeCollector;
import com.questrail.lightscan.internal.decode.DeviceDecodeException;
import com.questrail.lightscan.internal.decode.DeviceDecoder;
import com.questrail.lightscan.internal.time.MonotonicClock;
import com.questrail.lightscan.internal.time.SystemMonotonicClock;
import com.questrail.lightscan.model.Device;
import com.questrail.lightscan.observability.DatagramRejectedEvent;
import com.questrail.lightscan.observability.DiscoveryObservabilitySink;
import com.questrail.lightscan.observability.DiscoverySessionStarted;
import com.questrail.lightscan.observability.DiscoverySessionSummary;
import com.questrail.lightscan.observability.Slf4jDiscoveryObservabilitySink;
import com.questrail.lightscan.transport.DatagramEndpoint;
import com.questrail.lightscan.transport.InboundDatagram;
import com.questrail.lightscan.transport.TransportSendException;
import com.questrail.lightscan.transport.udp.netty.NettyMulticastDatagramEndpoint;

import java.net.Inet4Address;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * DiscoveryTransport
 * =============================================================================
 * Runs discovery sessions over a multicast-joined datagram endpoint.
 *
 * <h2>Inbound path (decode-before-collect)</h2>
 *
 * <pre>
 *   DatagramEndpoint.poll()
 *        → ResponseParser
 *            → AdvertisedLocation
 *                → DeviceDecoder
 *                    → DedupeCollector
 * </pre>
 *
 * <h2>Session contract</h2>
 * <ul>
 *   <li>Exactly one search datagram is sent per {@link #discover(Duration)} call.
 *       A send failure aborts the call with {@link TransportSendException}.</li>
 *   <li>The endpoint is then polled without blocking until the timeout has
 *       elapsed on the {@link MonotonicClock}. No datagram is polled after the
 *       deadline; one already being processed when it passes is completed.
 *       Later arrivals stay on the endpoint and are seen by the next session.</li>
 *   <li>Parse and decode failures drop that datagram only. They are reported to
 *       the {@link DiscoveryObservabilitySink} and never surface to the caller.</li>
 * </ul>
 *
 * <h2>Execution Model</h2>
 * A session runs entirely on the caller's thread. The transport owns its
 * endpoint exclusively and is not meant to be shared between concurrent
 * sessions; a caller wanting parallel sessions creates one transport each.
 */
public final class DiscoveryTransport implements AutoCloseable
{
    private final DatagramEndpoint endpoint;
    private final SocketAddress multicastGroup;
    private final ResponseParser parser;
    private final DeviceDecoder decoder;
    private final MonotonicClock clock;
    private final DiscoveryObservabilitySink observabilitySink;

    private volatile boolean closed;

    public DiscoveryTransport(DatagramEndpoint endpoint,
                              SocketAddress multicastGroup,
                              ResponseParser parser,
                              DeviceDecoder decoder,
                              MonotonicClock clock,
                              DiscoveryObservabilitySink observabilitySink) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.multicastGroup = Objects.requireNonNull(multicastGroup, "multicastGroup");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Opens a transport on the fixed group {@code 239.255.255.250:1982}, local port 7821.
     *
     * @throws ConfigurationException if the socket cannot be set up
     */
    public static DiscoveryTransport create() {
        return create(DiscoveryConfig.defaults());
    }

    /**
     * Opens a transport on the given group, bound to {@code 0.0.0.0:localBindPort}.
     *
     * @throws ConfigurationException if the group is not IPv4 multicast, or the
     *         socket cannot be bound or joined to the group
     */
    public static DiscoveryTransport create(InetSocketAddress multicastGroup, int localBindPort) {
        return create(DiscoveryConfig.builder()
                .withMulticastGroup(multicastGroup)
                .withLocalPort(localBindPort)
                .build());
    }

    /**
     * Opens a transport that reports to SLF4J.
     *
     * @throws ConfigurationException if the socket cannot be set up
     */
    public static DiscoveryTransport create(DiscoveryConfig config) {
        return create(config, new Slf4jDiscoveryObservabilitySink());
    }

    /**
     * @throws ConfigurationException if the socket cannot be set up
     */
    public static DiscoveryTransport create(DiscoveryConfig config, DiscoveryObservabilitySink observabilitySink) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        NettyMulticastDatagramEndpoint endpoint = NettyMulticastDatagramEndpoint.open(config);
        return new DiscoveryTransport(
                endpoint,
                config.multicastGroup(),
                new DefaultResponseParser(),
                new DeviceDecoder(),
                SystemMonotonicClock.INSTANCE,
                observabilitySink
        );
    }

    public SocketAddress multicastGroup() {
        return multicastGroup;
    }

    /**
     * Sends one search query and collects the devices that answer within {@code timeout}.
     *
     * @param timeout length of the receive window
     * @return the distinct devices seen, first advertisement per id
     *
     * @throws TransportSendException if the search query cannot be sent
     * @throws IllegalStateException if the transport has been closed
     */
    public Set<Device> discover(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        if (closed) {
            throw new IllegalStateException("DiscoveryTransport is closed");
        }

        final long windowNanos = saturatedNanos(timeout);
        final long startNanos = clock.nowNanos();

        endpoint.send(multicastGroup, SearchRequest.payload());
        observabilitySink.onSessionStarted(new DiscoverySessionStarted(Instant.now(), multicastGroup, timeout));

        final DedupeCollector collector = new DedupeCollector();
        int received = 0;
        int rejected = 0;
        int duplicates = 0;

        while (clock.nowNanos() - startNanos < windowNanos) {
            Optional<InboundDatagram> next = endpoint.poll();
            if (next.isEmpty()) {
                Thread.onSpinWait();
                continue;
            }

            received++;
            switch (process(next.get(), collector)) {
                case REJECTED -> rejected++;
                case DUPLICATE -> duplicates++;
                case COLLECTED -> { }
            }
        }

        observabilitySink.onSessionCompleted(new DiscoverySessionSummary(
                Instant.now(),
                Duration.ofNanos(clock.nowNanos() - startNanos),
                received,
                rejected,
                duplicates,
                collector.size()
        ));
        return collector.finish();
    }

    /**
     * Releases the endpoint. Idempotent.
     */
    @Override
    public void close() {
        closed = true;
        endpoint.close();
    }

    private enum Outcome { COLLECTED, DUPLICATE, REJECTED }

    private Outcome process(InboundDatagram datagram, DedupeCollector collector) {
        // 1) Only IPv4 senders can be lights on this group
        if (!(datagram.sender() instanceof InetSocketAddress source)
                || !(source.getAddress() instanceof Inet4Address)) {
            return reject(datagram, "sender is not an IPv4 address", null);
        }

        // 2) Bytes -> status line + headers (drop malformed framing)
        final ParsedResponse response;
        try {
            response = parser.parse(datagram.payload());
        } catch (ResponseParseException e) {
            return reject(datagram, "malformed response", e);
        }

        // 3) Headers -> device (drop incomplete or invalid advertisements)
        final Device device;
        try {
            InetSocketAddress location = AdvertisedLocation.resolve(response.headers(), source);
            device = decoder.decode(response.headers(), location);
        } catch (DeviceDecodeException e) {
            return reject(datagram, "invalid advertisement field '" + e.field() + "'", e);
        }

        // 4) First advertisement per id wins
        if (collector.offer(device)) {
            observabilitySink.onDeviceDiscovered(device);
            return Outcome.COLLECTED;
        }
        observabilitySink.onDuplicateDiscarded(device);
        return Outcome.DUPLICATE;
    }

    private Outcome reject(InboundDatagram datagram, String reason, Throwable cause) {
        observabilitySink.onDatagramRejected(new DatagramRejectedEvent(Instant.now(), datagram.sender(), reason, cause));
        return Outcome.REJECTED;
    }

    private static long saturatedNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
