package com.questrail.lightscan.model;

/**
 * An RGB color triple, each channel in the range 0–255.
 *
 * <p>Advertisements carry the color as a single decimal integer holding a
 * packed 24-bit value ({@code 0xRRGGBB}); {@link #fromPacked(int)} unpacks it.</p>
 */
public record Rgb(int red, int green, int blue)
{
    /** Largest packed value representable in 24 bits. */
    public static final int MAX_PACKED = 0xFFFFFF;

    public Rgb {
        requireChannel("red", red);
        requireChannel("green", green);
        requireChannel("blue", blue);
    }

    /**
     * Unpacks a 24-bit {@code 0xRRGGBB} value.
     *
     * @throws IllegalArgumentException if {@code packed} is negative or wider than 24 bits
     */
    public static Rgb fromPacked(int packed) {
        if (packed < 0 || packed > MAX_PACKED) {
            throw new IllegalArgumentException("Packed RGB value out of range: " + packed);
        }
        return new Rgb((packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF);
    }

    /**
     * Returns the color packed as {@code 0xRRGGBB}.
     */
    public int packed() {
        return (red << 16) | (green << 8) | blue;
    }

    private static void requireChannel(String name, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " must be in range 0-255 (was " + value + ")");
        }
    }
}
