package com.questrail.lightscan.transport;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * One received datagram: the sender and a private copy of the payload.
 *
 * <p>The payload is treated as an atomic unit (a full datagram, possibly
 * truncated to the receive buffer size by the transport).</p>
 */
public record InboundDatagram(SocketAddress sender, byte[] payload)
{
    public InboundDatagram {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(payload, "payload");
    }
}
