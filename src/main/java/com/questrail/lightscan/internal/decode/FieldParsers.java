package com.questrail.lightscan.internal.decode;

import com.questrail.lightscan.model.ColorMode;
import com.questrail.lightscan.model.PowerStatus;
import com.questrail.lightscan.model.Rgb;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Typed conversions for advertisement field values.
 *
 * <p>Each method throws {@link IllegalArgumentException} on input it rejects;
 * {@link FieldExtractor} turns that into a {@link FieldInvalidException}.</p>
 */
final class FieldParsers
{
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** ASCII digits with an optional plus sign. */
    private static final Pattern DECIMAL = Pattern.compile("\\+?[0-9]+");

    private FieldParsers() {}

    static int unsigned8(String raw)
    {
        return unsigned(raw, 0xFF);
    }

    static int unsigned16(String raw)
    {
        return unsigned(raw, 0xFFFF);
    }

    static PowerStatus power(String raw)
    {
        return PowerStatus.fromWire(raw)
                .orElseThrow(() -> new IllegalArgumentException("Unknown power status"));
    }

    static ColorMode colorMode(String raw)
    {
        return ColorMode.fromCode(unsigned8(raw))
                .orElseThrow(() -> new IllegalArgumentException("Unknown color mode code"));
    }

    static Rgb rgb(String raw)
    {
        return Rgb.fromPacked(unsigned(raw, Rgb.MAX_PACKED));
    }

    /**
     * Splits on runs of whitespace; blank input yields an empty set.
     */
    static Set<String> tokens(String raw)
    {
        final String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptySet();
        }
        return new LinkedHashSet<>(Arrays.asList(WHITESPACE.split(trimmed)));
    }

    private static int unsigned(String raw, int max)
    {
        // Integer.parseInt alone would take other Unicode digits and "-0".
        if (!DECIMAL.matcher(raw).matches()) {
            throw new IllegalArgumentException("Not an unsigned decimal integer");
        }
        final int value = Integer.parseInt(raw);
        if (value < 0 || value > max) {
            throw new IllegalArgumentException("Value out of range 0-" + max + ": " + value);
        }
        return value;
    }
}
