package com.questrail.lightscan.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing the totals of a completed discovery session.
 */
public record DiscoverySessionSummary(
    Instant timestamp,
    Duration elapsed,
    int datagramsReceived,
    int datagramsRejected,
    int duplicatesDiscarded,
    int devicesDiscovered
) {
}
