package com.questrail.lightscan.connection;

import com.questrail.lightscan.model.Device;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Opens control streams to discovered devices, on demand.
 *
 * <p>Connecting is never part of discovery; callers decide if and when to
 * connect to a {@link Device}.</p>
 */
public interface DeviceConnector
{
    /**
     * Opens a stream to {@code location}.
     *
     * @throws DeviceConnectionException if the connection cannot be established
     */
    DeviceConnection connect(InetSocketAddress location);

    /**
     * Opens a stream to the device's advertised location.
     *
     * @throws DeviceConnectionException if the connection cannot be established
     */
    default DeviceConnection connect(Device device) {
        Objects.requireNonNull(device, "device");
        return connect(device.location());
    }
}
