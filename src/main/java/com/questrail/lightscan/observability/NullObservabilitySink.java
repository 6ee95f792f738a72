package com.questrail.lightscan.observability;

import com.questrail.lightscan.model.Device;

/**
 * No-op implementation of DiscoveryObservabilitySink.
 */
public final class NullObservabilitySink implements DiscoveryObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionStarted(DiscoverySessionStarted event) {}

    @Override
    public void onDeviceDiscovered(Device device) {}

    @Override
    public void onDuplicateDiscarded(Device device) {}

    @Override
    public void onDatagramRejected(DatagramRejectedEvent event) {}

    @Override
    public void onSessionCompleted(DiscoverySessionSummary summary) {}
}
