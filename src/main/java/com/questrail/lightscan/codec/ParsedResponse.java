package com.questrail.lightscan.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed advertisement: the HTTP-style status line and its headers.
 *
 * <p>Header names keep the case they were sent with. When a name repeats, the
 * last value wins.</p>
 */
public record ParsedResponse(
        int statusCode,
        String reason,
        Map<String, String> headers
) {
    public ParsedResponse {
        Objects.requireNonNull(reason, "reason");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(headers, "headers")));
    }

    /**
     * Returns the value of a header, matching the name exactly.
     */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
}
