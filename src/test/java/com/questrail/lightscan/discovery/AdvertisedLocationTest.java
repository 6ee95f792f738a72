package com.questrail.lightscan.discovery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetSocketAddress;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AdvertisedLocationTest
{
    private static final InetSocketAddress SOURCE = new InetSocketAddress("10.0.0.9", 1982);

    @Test
    void locationHeaderIsPreferred()
    {
        InetSocketAddress location = AdvertisedLocation.resolve(
                Map.of("Location", "yeelight://192.168.1.239:55443"), SOURCE);

        assertEquals(new InetSocketAddress("192.168.1.239", 55443), location);
    }

    @Test
    void sourceIsUsedWhenHeaderIsAbsent()
    {
        assertEquals(SOURCE, AdvertisedLocation.resolve(Map.of("id", "0x1"), SOURCE));
    }

    @Test
    void headerNameIsCaseSensitive()
    {
        assertEquals(SOURCE, AdvertisedLocation.resolve(
                Map.of("location", "yeelight://192.168.1.239:55443"), SOURCE));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "yeelight://192.168.1.239",
            "yeelight://300.1.1.1:55443",
            "yeelight://bulb.local:55443",
            "yeelight://[::1]:55443",
            "not a uri at all",
            "yeelight://192.168.1:55443"
    })
    void malformedHeaderFallsBackToSource(String value)
    {
        assertEquals(SOURCE, AdvertisedLocation.resolve(Map.of("Location", value), SOURCE));
    }

    @Test
    void surroundingWhitespaceIsIgnored()
    {
        assertEquals(new InetSocketAddress("192.168.1.2", 55443),
                AdvertisedLocation.parse(" yeelight://192.168.1.2:55443 ").orElseThrow());
    }

    @Test
    void parsedAddressIsResolvedLiteral()
    {
        InetSocketAddress address = AdvertisedLocation.parse("yeelight://192.168.1.2:55443").orElseThrow();

        assertFalse(address.isUnresolved());
        assertEquals("192.168.1.2", address.getAddress().getHostAddress());
    }
}
