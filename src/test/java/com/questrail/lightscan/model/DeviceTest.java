package com.questrail.lightscan.model;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class DeviceTest
{
    private static Device.Builder complete(String id)
    {
        return Device.builder()
                .withLocation(new InetSocketAddress("192.168.1.30", 55443))
                .withId(DeviceId.of(id))
                .withModel("mono")
                .withFirmwareVersion(45)
                .withSupportedCommands(Set.of("get_prop", "toggle"))
                .withPower(PowerStatus.OFF)
                .withBrightness(80)
                .withColorMode(ColorMode.COLOR)
                .withColorTemperature(2700)
                .withRgb(Rgb.fromPacked(0x00FF00))
                .withHue(120)
                .withSaturation(100)
                .withName("desk");
    }

    @Test
    void equalityIsByIdentityOnly()
    {
        Device a = complete("0xAB").build();
        Device b = complete("0xAB").withPower(PowerStatus.ON).withName("other").build();
        Device c = complete("0xAC").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void builderRejectsMissingComponent()
    {
        assertThrows(NullPointerException.class,
                () -> complete("0x1").withName(null).build());
        assertThrows(NullPointerException.class,
                () -> Device.builder().withId(DeviceId.of("0x1")).build());
    }

    @Test
    void builderRejectsOutOfRangeNumbers()
    {
        assertThrows(IllegalArgumentException.class, () -> complete("0x1").withBrightness(256));
        assertThrows(IllegalArgumentException.class, () -> complete("0x1").withFirmwareVersion(-1));
        assertThrows(IllegalArgumentException.class, () -> complete("0x1").withHue(65536));
    }

    @Test
    void supportedCommandsAreImmutable()
    {
        Device device = complete("0x1").build();

        assertThrows(UnsupportedOperationException.class, () -> device.supportedCommands().add("set_rgb"));
    }

    @Test
    void rgbPacksAndUnpacks()
    {
        Rgb rgb = Rgb.fromPacked(0x0A0B0C);

        assertEquals(new Rgb(10, 11, 12), rgb);
        assertEquals(0x0A0B0C, rgb.packed());
        assertThrows(IllegalArgumentException.class, () -> Rgb.fromPacked(0x1000000));
        assertThrows(IllegalArgumentException.class, () -> new Rgb(256, 0, 0));
    }

    @Test
    void wireEnumsMatchExactly()
    {
        assertEquals(PowerStatus.ON, PowerStatus.fromWire("on").orElseThrow());
        assertTrue(PowerStatus.fromWire("ON").isEmpty());
        assertEquals(ColorMode.HSV, ColorMode.fromCode(3).orElseThrow());
        assertTrue(ColorMode.fromCode(0).isEmpty());
    }
}
