package com.questrail.lightscan.codec;

/**
 * Indicates that a received datagram is not a well-formed advertisement.
 *
 * This typically reflects:
 * <ul>
 *   <li>A missing or malformed status line</li>
 *   <li>A header line without a name/value separator</li>
 *   <li>More headers than the parser accepts</li>
 * </ul>
 *
 * The offending datagram is dropped; the discovery session continues.
 */
public final class ResponseParseException extends RuntimeException
{
    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
