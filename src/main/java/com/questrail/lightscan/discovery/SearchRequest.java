package com.questrail.lightscan.discovery;

import java.nio.charset.StandardCharsets;

/**
 * The discovery query sent to the multicast group at the start of every session.
 *
 * <p>The byte content is fixed; lights match on the {@code ST: wifi_bulb}
 * search target and answer the sender by unicast.</p>
 */
public final class SearchRequest
{
    /** Exact query text. No trailing line break. */
    public static final String TEXT =
            "M-SEARCH * HTTP/1.1\r\n"
            + "HOST: 239.255.255.250:1982\r\n"
            + "MAN: \"ssdp:discover\"\r\n"
            + "ST: wifi_bulb";

    private static final byte[] BYTES = TEXT.getBytes(StandardCharsets.US_ASCII);

    private SearchRequest() {}

    /**
     * Returns a fresh copy of the query bytes.
     */
    public static byte[] payload() {
        return BYTES.clone();
    }
}
