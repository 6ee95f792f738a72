package com.questrail.lightscan.config;

/**
 * Indicates that a discovery transport cannot be set up.
 *
 * This typically reflects:
 * <ul>
 *   <li>A group address outside the IPv4 multicast range</li>
 *   <li>A local port that cannot be bound</li>
 *   <li>A failure to join the multicast group</li>
 * </ul>
 *
 * Raised at construction time; no discovery session starts.
 */
public final class ConfigurationException extends RuntimeException
{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
