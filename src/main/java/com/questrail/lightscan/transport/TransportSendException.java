package com.questrail.lightscan.transport;

/**
 * Indicates that an outbound datagram could not be sent.
 *
 * For discovery this is fatal to the current session: without the search query
 * no light will answer.
 */
public final class TransportSendException extends RuntimeException
{
    public TransportSendException(String message) {
        super(message);
    }

    public TransportSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
