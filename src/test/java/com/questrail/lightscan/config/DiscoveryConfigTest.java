package com.questrail.lightscan.config;

import com.questrail.lightscan.discovery.DiscoveryTransport;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveryConfigTest
{
    @Test
    void defaultsUseFixedGroupAndPort()
    {
        DiscoveryConfig config = DiscoveryConfig.defaults();

        assertEquals(new InetSocketAddress("239.255.255.250", 1982), config.multicastGroup());
        assertTrue(config.multicastGroup().getAddress().isMulticastAddress());
        assertEquals(7821, config.localPort());
        assertNull(config.networkInterface());
        assertEquals(1024, config.receiveBufferSize());
    }

    @Test
    void builderOverridesDefaults()
    {
        DiscoveryConfig config = DiscoveryConfig.builder()
                .withMulticastGroup(new InetSocketAddress("224.0.0.251", 5353))
                .withLocalPort(0)
                .withNetworkInterface("eth0")
                .withReceiveBufferSize(2048)
                .build();

        assertEquals(5353, config.multicastGroup().getPort());
        assertEquals(0, config.localPort());
        assertEquals("eth0", config.networkInterface());
        assertEquals(2048, config.receiveBufferSize());
    }

    @Test
    void rejectsUnicastGroup()
    {
        ConfigurationException e = assertThrows(ConfigurationException.class, () ->
                DiscoveryConfig.builder().withMulticastGroup(new InetSocketAddress("223.0.0.255", 80)).build());

        assertTrue(e.getMessage().contains("223.0.0.255"));
    }

    @Test
    void rejectsIpv6Group()
    {
        assertThrows(ConfigurationException.class, () ->
                DiscoveryConfig.builder().withMulticastGroup(new InetSocketAddress("ff02::c", 1982)).build());
    }

    @Test
    void rejectsUnresolvedGroup()
    {
        assertThrows(ConfigurationException.class, () ->
                DiscoveryConfig.builder()
                        .withMulticastGroup(InetSocketAddress.createUnresolved("239.255.255.250", 1982))
                        .build());
    }

    @Test
    void rejectsOutOfRangeValues()
    {
        assertThrows(ConfigurationException.class,
                () -> DiscoveryConfig.builder().withMulticastGroup(null).build());
        assertThrows(ConfigurationException.class,
                () -> DiscoveryConfig.builder().withMulticastGroup(new InetSocketAddress("239.255.255.250", 0)).build());
        assertThrows(ConfigurationException.class,
                () -> DiscoveryConfig.builder().withLocalPort(-1).build());
        assertThrows(ConfigurationException.class,
                () -> DiscoveryConfig.builder().withLocalPort(65536).build());
        assertThrows(ConfigurationException.class,
                () -> DiscoveryConfig.builder().withNetworkInterface("  ").build());
        assertThrows(ConfigurationException.class,
                () -> DiscoveryConfig.builder().withReceiveBufferSize(0).build());
    }

    @Test
    void transportCreationRejectsUnicastGroupBeforeOpeningSocket()
    {
        assertThrows(ConfigurationException.class,
                () -> DiscoveryTransport.create(new InetSocketAddress("223.0.0.255", 80), 1234));
    }
}
