/**
 * Advertisement Codec
 * =============================================================================
 *
 * <p>The codec layer turns one received datagram into a {@link
 * com.questrail.lightscan.codec.ParsedResponse}: an HTTP/1.1-style status line
 * followed by {@code Name: value} header lines.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] datagram
 *        → ResponseParser        (text rules applied here)
 *            → ParsedResponse    (status line + header map)
 *                → DeviceDecoder
 *                    → Device
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The parser never interprets header values; field typing lives in the decoder.</li>
 *   <li>A parse failure is a defect of that datagram only and never aborts a session.</li>
 * </ul>
 */
package com.questrail.lightscan.codec;
