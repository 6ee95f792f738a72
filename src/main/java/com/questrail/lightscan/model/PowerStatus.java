package com.questrail.lightscan.model;

import java.util.Optional;

/**
 * Power state reported in the {@code power} field of an advertisement.
 */
public enum PowerStatus
{
    ON("on"),
    OFF("off");

    private final String wireValue;

    PowerStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Returns the exact token used on the wire.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolves a wire token. Matching is exact and case-sensitive.
     *
     * @param raw the advertised value
     * @return the matching status, or empty if {@code raw} is neither {@code on} nor {@code off}
     */
    public static Optional<PowerStatus> fromWire(String raw) {
        for (PowerStatus status : values()) {
            if (status.wireValue.equals(raw)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
