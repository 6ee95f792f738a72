package com.questrail.lightscan.observability;

import java.net.SocketAddress;
import java.time.Duration;
import java.time.Instant;

/**
 * Record representing the start of a discovery session.
 */
public record DiscoverySessionStarted(
    Instant timestamp,
    SocketAddress multicastGroup,
    Duration timeout
) {
}
