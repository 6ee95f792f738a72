package com.questrail.lightscan.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>deciding when to send the search query</li>
 *   <li>polling inbound datagrams within a session deadline</li>
 *   <li>feeding each datagram into the parse/decode pipeline</li>
 * </ul>
 *
 * <p>The endpoint is opened (bound, group joined) by its factory and is ready
 * on return. Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint extends AutoCloseable
{
    /**
     * Send a datagram to the specified remote endpoint.
     *
     * <p>Completes when the datagram has been handed to the network stack.</p>
     *
     * @param remote remote destination
     * @param payload datagram payload
     * @throws TransportSendException if the datagram could not be sent
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Returns the next received datagram, if one is available.
     *
     * <p>This method MUST NOT block. An empty result means nothing has arrived
     * yet; it is not an error.</p>
     */
    Optional<InboundDatagram> poll();

    /**
     * Release all transport resources. Idempotent.
     */
    @Override
    void close();
}
