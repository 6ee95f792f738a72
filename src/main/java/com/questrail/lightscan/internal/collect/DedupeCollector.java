package com.questrail.lightscan.internal.collect;

import com.questrail.lightscan.model.Device;
import com.questrail.lightscan.model.DeviceId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DedupeCollector
 * -----------------------------------------------------------------------------
 * Accumulates the devices seen during one discovery session, keyed by
 * {@link DeviceId}.
 *
 * <p>The first advertisement for an id wins. A later advertisement for the same
 * id is discarded even when its other fields differ, so a state change between
 * two responses within one session is not reflected in the result.</p>
 *
 * <p>Not thread-safe: one collector per session, used from the session's thread.</p>
 */
public final class DedupeCollector
{
    private final Map<DeviceId, Device> devices = new LinkedHashMap<>();

    /**
     * Offers a decoded device to the collection.
     *
     * @return {@code true} if the device was added, {@code false} if its id was already present
     */
    public boolean offer(Device device)
    {
        Objects.requireNonNull(device, "device");
        return devices.putIfAbsent(device.id(), device) == null;
    }

    /**
     * Number of distinct devices collected so far.
     */
    public int size()
    {
        return devices.size();
    }

    /**
     * Returns the collected devices. No two share an id; order is not significant.
     */
    public Set<Device> finish()
    {
        return Collections.unmodifiableSet(new LinkedHashSet<>(devices.values()));
    }
}
