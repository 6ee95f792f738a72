package com.questrail.lightscan;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared advertisement fixtures for tests.
 */
public final class Advertisements {

    private Advertisements() {}

    /**
     * A complete, well-formed header map for a ceiling light in color temperature mode.
     */
    public static Map<String, String> headers() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("id", "0x1234");
        m.put("model", "floor");
        m.put("fw_ver", "40");
        m.put("power", "on");
        m.put("support", "get_power set_power get_rgb set_rgb");
        m.put("bright", "34");
        m.put("color_mode", "2");
        m.put("ct", "0");
        m.put("rgb", "657930");
        m.put("hue", "314");
        m.put("sat", "12");
        m.put("name", "room_light");
        return m;
    }

    /**
     * A raw advertisement as a light would send it, with the given id.
     */
    public static byte[] datagram(String id) {
        return datagram(id, "on");
    }

    public static byte[] datagram(String id, String power) {
        String text = "HTTP/1.1 200 OK\r\n"
                + "Cache-Control: max-age=3600\r\n"
                + "Date: \r\n"
                + "Ext: \r\n"
                + "Location: yeelight://192.168.1.239:55443\r\n"
                + "Server: POSIX UPnP/1.0 YGLC/1\r\n"
                + "id: " + id + "\r\n"
                + "model: color\r\n"
                + "fw_ver: 18\r\n"
                + "support: get_prop set_default set_power toggle set_bright start_cf stop_cf\r\n"
                + "power: " + power + "\r\n"
                + "bright: 100\r\n"
                + "color_mode: 1\r\n"
                + "ct: 4000\r\n"
                + "rgb: 16711680\r\n"
                + "hue: 100\r\n"
                + "sat: 35\r\n"
                + "name: my_bulb\r\n";
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Header lines followed by the given number of trailing NUL bytes, as left
     * in a fixed-size receive buffer.
     */
    public static byte[] padded(byte[] payload, int padding) {
        byte[] out = new byte[payload.length + padding];
        System.arraycopy(payload, 0, out, 0, payload.length);
        return out;
    }
}
