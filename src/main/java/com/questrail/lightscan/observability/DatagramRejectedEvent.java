package com.questrail.lightscan.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a datagram dropped during a discovery session.
 *
 * @param cause the parse or decode failure; {@code null} when the datagram was
 *              rejected without an exception (e.g. a non-IPv4 sender)
 */
public record DatagramRejectedEvent(
    Instant timestamp,
    SocketAddress sender,
    String reason,
    Throwable cause
) {
}
