package com.questrail.lightscan.observability;

import com.questrail.lightscan.model.Device;

/**
 * Main interface for receiving discovery observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DiscoveryObservabilitySink {
    /**
     * Called once per session, after the search query has been sent.
     * @param event the session start details
     */
    void onSessionStarted(DiscoverySessionStarted event);

    /**
     * Called when an advertisement yields a device not seen before in the session.
     * @param device the newly collected device
     */
    void onDeviceDiscovered(Device device);

    /**
     * Called when an advertisement repeats an id already collected in the session.
     * @param device the discarded duplicate
     */
    void onDuplicateDiscarded(Device device);

    /**
     * Called when a datagram is dropped because it could not be parsed or decoded.
     * @param event the rejection details
     */
    void onDatagramRejected(DatagramRejectedEvent event);

    /**
     * Called once per session, when the receive window has elapsed.
     * @param summary the session totals
     */
    void onSessionCompleted(DiscoverySessionSummary summary);
}
