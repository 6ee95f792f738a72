package com.questrail.lightscan.discovery;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves the control endpoint of an advertising light.
 *
 * <p>Lights usually advertise their control endpoint in a {@code Location}
 * header, e.g. {@code yeelight://192.168.1.239:55443}. When that header is
 * present and names an IPv4 literal with a port, it is used. Otherwise the UDP
 * source address of the advertisement is the location.</p>
 *
 * <p>A malformed {@code Location} never rejects the advertisement; it only
 * loses to the source address.</p>
 */
final class AdvertisedLocation
{
    static final String LOCATION_HEADER = "Location";

    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private AdvertisedLocation() {}

    static InetSocketAddress resolve(Map<String, String> headers, InetSocketAddress source)
    {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(source, "source");

        String advertised = headers.get(LOCATION_HEADER);
        if (advertised == null) {
            return source;
        }
        return parse(advertised).orElse(source);
    }

    static Optional<InetSocketAddress> parse(String value)
    {
        final URI uri;
        try {
            uri = new URI(value.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }

        String host = uri.getHost();
        int port = uri.getPort();
        if (host == null || port <= 0 || port > 0xFFFF || !IPV4_LITERAL.matcher(host).matches()) {
            return Optional.empty();
        }

        final byte[] octets = new byte[4];
        final String[] parts = host.split("\\.");
        for (int i = 0; i < 4; i++) {
            int octet = Integer.parseInt(parts[i]);
            if (octet > 255) {
                return Optional.empty();
            }
            octets[i] = (byte) octet;
        }

        try {
            return Optional.of(new InetSocketAddress(InetAddress.getByAddress(octets), port));
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Four-byte address rejected", e);
        }
    }
}
