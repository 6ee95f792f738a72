package com.questrail.lightscan.model;

import java.util.Optional;

/**
 * ColorMode
 * -----------------------------------------------------------------------------
 * The active color mode advertised in the {@code color_mode} field.
 *
 * <p>The wire carries a small numeric code. The mapping is closed:</p>
 * <ul>
 *   <li>{@code 1} → {@link #COLOR} (the {@code rgb} field is meaningful)</li>
 *   <li>{@code 2} → {@link #COLOR_TEMPERATURE} (the {@code ct} field is meaningful)</li>
 *   <li>{@code 3} → {@link #HSV} (the {@code hue} and {@code sat} fields are meaningful)</li>
 * </ul>
 *
 * <p>Any other code is rejected; unknown codes are never guessed.</p>
 */
public enum ColorMode
{
    COLOR(1),
    COLOR_TEMPERATURE(2),
    HSV(3);

    private final int code;

    ColorMode(int code) {
        this.code = code;
    }

    /**
     * Returns the numeric code used on the wire.
     */
    public int code() {
        return code;
    }

    /**
     * Resolves a numeric wire code.
     *
     * @param code the advertised code
     * @return the matching mode, or empty if the code is not one of 1, 2 or 3
     */
    public static Optional<ColorMode> fromCode(int code) {
        for (ColorMode mode : values()) {
            if (mode.code == code) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
