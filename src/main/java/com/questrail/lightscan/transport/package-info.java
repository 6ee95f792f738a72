/**
 * Discovery Transport Ports
 * =============================================================================
 *
 * These types define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty UDP, a test double) and
 * the discovery session logic.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the socket work in production <strong>without</strong> its types
 * leaking into the discovery core. Everything above the transport adapter sees
 * only:
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no parsing or decoding)</li>
 *   <li>Never invent outbound traffic</li>
 *   <li>Never block in {@link com.questrail.lightscan.transport.DatagramEndpoint#poll()}</li>
 * </ul>
 */
package com.questrail.lightscan.transport;
