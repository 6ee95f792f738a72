package com.questrail.lightscan.connection;

import java.net.InetSocketAddress;

/**
 * An open control stream to one discovered device.
 *
 * <p>The handle is obtained from {@link DeviceConnector#connect} and is
 * independent of the {@link com.questrail.lightscan.model.Device} it was opened
 * for: closing it, or failing to open it, leaves the device value unchanged.
 * No command encoding lives here.</p>
 */
public interface DeviceConnection extends AutoCloseable
{
    /**
     * Endpoint this connection was opened to.
     */
    InetSocketAddress remoteAddress();

    /**
     * Returns {@code true} while the stream is open.
     */
    boolean isOpen();

    /**
     * Close the stream. Idempotent.
     */
    @Override
    void close();
}
