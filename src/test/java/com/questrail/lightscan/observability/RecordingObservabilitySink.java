package com.questrail.lightscan.observability;

import com.questrail.lightscan.model.Device;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements DiscoveryObservabilitySink {
    public record Discovered(Device device) {}
    public record Duplicate(Device device) {}

    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onSessionStarted(DiscoverySessionStarted event) {
        events.add(event);
    }

    @Override
    public synchronized void onDeviceDiscovered(Device device) {
        events.add(new Discovered(device));
    }

    @Override
    public synchronized void onDuplicateDiscarded(Device device) {
        events.add(new Duplicate(device));
    }

    @Override
    public synchronized void onDatagramRejected(DatagramRejectedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSessionCompleted(DiscoverySessionSummary summary) {
        events.add(summary);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<DatagramRejectedEvent> getRejections() {
        return events.stream()
            .filter(e -> e instanceof DatagramRejectedEvent)
            .map(e -> (DatagramRejectedEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized DiscoverySessionSummary getLastSummary() {
        DiscoverySessionSummary last = null;
        for (Object e : events) {
            if (e instanceof DiscoverySessionSummary s) {
                last = s;
            }
        }
        return last;
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
