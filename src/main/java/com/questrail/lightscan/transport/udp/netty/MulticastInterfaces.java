package com.questrail.lightscan.transport.udp.netty;

import com.questrail.lightscan.config.ConfigurationException;

import java.net.Inet4Address;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Collections;
import java.util.List;

/**
 * Chooses the network interface used to join the discovery group.
 */
final class MulticastInterfaces
{
    private MulticastInterfaces() {}

    /**
     * Resolves the interface to join on.
     *
     * <p>With a name, that interface must exist. Without one, the first interface
     * that is up, not loopback, multicast-capable and carries an IPv4 address is
     * chosen; a host with no such interface falls back to an up loopback
     * interface so that local discovery still works.</p>
     *
     * @throws ConfigurationException if no usable interface is found
     */
    static NetworkInterface resolve(String name)
    {
        try {
            if (name != null) {
                NetworkInterface named = NetworkInterface.getByName(name);
                if (named == null) {
                    throw new ConfigurationException("Unknown network interface: " + name);
                }
                return named;
            }

            List<NetworkInterface> all = Collections.list(NetworkInterface.getNetworkInterfaces());
            for (NetworkInterface ni : all) {
                if (ni.isUp() && !ni.isLoopback() && ni.supportsMulticast() && hasIpv4(ni)) {
                    return ni;
                }
            }
            for (NetworkInterface ni : all) {
                if (ni.isUp() && ni.isLoopback()) {
                    return ni;
                }
            }
        } catch (SocketException e) {
            throw new ConfigurationException("Cannot enumerate network interfaces", e);
        }
        throw new ConfigurationException("No multicast-capable IPv4 network interface available");
    }

    private static boolean hasIpv4(NetworkInterface ni)
    {
        return Collections.list(ni.getInetAddresses()).stream()
                .anyMatch(a -> a instanceof Inet4Address);
    }
}
