package com.questrail.lightscan.model;

import java.util.Objects;

/**
 * Strongly typed representation of a device identity.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * A light reports a firmware-assigned {@code id} (for example {@code 0x000000000015243f})
 * in every advertisement. That value is stable across reboots and DHCP lease
 * changes, unlike the network location, and is therefore the only key used for
 * {@link Device} equality and for de-duplication within a discovery session.
 * </p>
 *
 * <p>
 * Wrapping the raw string keeps identity comparisons explicit: code that
 * compares devices compares {@code DeviceId}s, never arbitrary strings or
 * locations.
 * </p>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>The value is taken verbatim from the advertisement (no case folding)</li>
 *   <li>An empty value is representable; the firmware never sends one, but the
 *       decoder does not invent a rule the wire format does not state</li>
 * </ul>
 */
public final class DeviceId
{
    private final String value;

    private DeviceId(String value) {
        this.value = value;
    }

    /**
     * Creates a {@code DeviceId} for the given advertised identity.
     *
     * @param value the identity string as advertised
     * @return a {@code DeviceId} instance
     * @throws NullPointerException if {@code value} is null
     */
    public static DeviceId of(String value) {
        return new DeviceId(Objects.requireNonNull(value, "value"));
    }

    /**
     * Returns the identity string exactly as advertised.
     */
    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceId that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "DeviceId[" + value + "]";
    }
}
