package com.questrail.lightscan.connection;

/**
 * Indicates that a control stream to a device could not be opened.
 *
 * Has no effect on already-discovered devices.
 */
public final class DeviceConnectionException extends RuntimeException
{
    public DeviceConnectionException(String message) {
        super(message);
    }

    public DeviceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
