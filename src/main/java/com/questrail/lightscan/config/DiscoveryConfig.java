package com.questrail.lightscan.config;

import java.net.Inet4Address;
import java.net.InetSocketAddress;

/**
 * Configuration for a discovery transport.
 *
 * <ul>
 *   <li><b>multicastGroup</b>: group address and port the search query is sent
 *       to and advertisements arrive on. Must be IPv4 multicast.</li>
 *   <li><b>localPort</b>: port bound on the wildcard address. {@code 0} selects
 *       an ephemeral port.</li>
 *   <li><b>networkInterface</b>: name of the interface used to join the group
 *       (for example {@code eth0}); {@code null} selects one automatically.</li>
 *   <li><b>receiveBufferSize</b>: upper bound on a received datagram; longer
 *       datagrams are truncated.</li>
 * </ul>
 *
 * <p>The canonical constructor throws {@link ConfigurationException} for any
 * invalid value.</p>
 */
public record DiscoveryConfig(
    InetSocketAddress multicastGroup,
    int localPort,
    String networkInterface,
    int receiveBufferSize
) {
    public static final String MULTICAST_HOST = "239.255.255.250";
    public static final int MULTICAST_PORT = 1982;
    public static final int DEFAULT_LOCAL_PORT = 7821;
    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 1024;

    public DiscoveryConfig {
        if (multicastGroup == null) {
            throw new ConfigurationException("multicastGroup is required");
        }
        if (multicastGroup.isUnresolved()) {
            throw new ConfigurationException("Multicast group is unresolved: " + multicastGroup);
        }
        if (!(multicastGroup.getAddress() instanceof Inet4Address)
                || !multicastGroup.getAddress().isMulticastAddress()) {
            throw new ConfigurationException(
                    "Not an IPv4 multicast address (224.0.0.0-239.255.255.255): "
                            + multicastGroup.getAddress().getHostAddress());
        }
        if (multicastGroup.getPort() == 0) {
            throw new ConfigurationException("Multicast group port must be non-zero");
        }
        if (localPort < 0 || localPort > 0xFFFF) {
            throw new ConfigurationException("localPort must be in range 0-65535 (was " + localPort + ")");
        }
        if (networkInterface != null && networkInterface.isBlank()) {
            throw new ConfigurationException("networkInterface must not be blank");
        }
        if (receiveBufferSize <= 0) {
            throw new ConfigurationException("receiveBufferSize must be positive (was " + receiveBufferSize + ")");
        }
    }

    /**
     * The fixed discovery group, {@code 239.255.255.250:1982}.
     */
    public static InetSocketAddress defaultMulticastGroup() {
        return new InetSocketAddress(MULTICAST_HOST, MULTICAST_PORT);
    }

    /**
     * Default configuration: fixed group, local port 7821, automatic interface,
     * 1024-byte receive buffer.
     */
    public static DiscoveryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress multicastGroup = defaultMulticastGroup();
        private int localPort = DEFAULT_LOCAL_PORT;
        private String networkInterface;
        private int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;

        public Builder withMulticastGroup(InetSocketAddress multicastGroup) {
            this.multicastGroup = multicastGroup;
            return this;
        }

        public Builder withLocalPort(int localPort) {
            this.localPort = localPort;
            return this;
        }

        public Builder withNetworkInterface(String networkInterface) {
            this.networkInterface = networkInterface;
            return this;
        }

        public Builder withReceiveBufferSize(int receiveBufferSize) {
            this.receiveBufferSize = receiveBufferSize;
            return this;
        }

        public DiscoveryConfig build() {
            return new DiscoveryConfig(multicastGroup, localPort, networkInterface, receiveBufferSize);
        }
    }
}
