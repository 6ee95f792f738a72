package com.questrail.lightscan.codec;

/**
 * ResponseParser
 * -----------------------------------------------------------------------------
 * Text-level parser for discovery advertisements.
 *
 * <p>This interface defines the inbound boundary between raw transport bytes
 * (one UDP datagram payload) and a structured {@link ParsedResponse}.</p>
 *
 * <p>The parser is responsible only for:</p>
 * <ul>
 *   <li>Decoding bytes to text</li>
 *   <li>Validating the status line and header-line structure</li>
 *   <li>Constructing a {@link ParsedResponse} on success</li>
 * </ul>
 *
 * <p>The parser is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting header values</li>
 *   <li>Mapping headers to devices</li>
 *   <li>Buffering partial data across datagrams</li>
 * </ul>
 */
public interface ResponseParser
{
    /**
     * Parses a single complete datagram payload.
     *
     * @param datagram raw bytes received from the transport
     * @return the parsed status line and headers
     * @throws ResponseParseException if the payload is not a well-formed response
     */
    ParsedResponse parse(byte[] datagram);
}
