package com.questrail.lightscan.observability;

import com.questrail.lightscan.model.Device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DiscoveryObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDiscoveryObservabilitySink implements DiscoveryObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDiscoveryObservabilitySink.class);

    @Override
    public void onSessionStarted(DiscoverySessionStarted event) {
        log.info("Discovery started: query sent to {}, listening for {} ms",
            event.multicastGroup(),
            event.timeout().toMillis());
    }

    @Override
    public void onDeviceDiscovered(Device device) {
        log.info("Discovered {} '{}' ({}) at {}",
            device.model(),
            device.name(),
            device.id().value(),
            device.location());
    }

    @Override
    public void onDuplicateDiscarded(Device device) {
        log.debug("Duplicate advertisement for {} from {}", device.id().value(), device.location());
    }

    @Override
    public void onDatagramRejected(DatagramRejectedEvent event) {
        if (event.cause() != null) {
            log.debug("Dropped datagram from {}: {} ({})", event.sender(), event.reason(), event.cause().getMessage());
        } else {
            log.debug("Dropped datagram from {}: {}", event.sender(), event.reason());
        }
    }

    @Override
    public void onSessionCompleted(DiscoverySessionSummary summary) {
        log.info("Discovery finished in {} ms: {} device(s), {} datagram(s) received, {} rejected, {} duplicate(s)",
            summary.elapsed().toMillis(),
            summary.devicesDiscovered(),
            summary.datagramsReceived(),
            summary.datagramsRejected(),
            summary.duplicatesDiscarded());
    }
}
