package com.questrail.lightscan.model;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Device
 * =============================================================================
 * One discovered light, as described by a single advertisement.
 *
 * <h2>Identity</h2>
 * <p>
 * Equality and hashing are defined by {@link #id()} alone. Two {@code Device}
 * values with the same id and different state (power, brightness, location
 * after a DHCP change, ...) are the same device. De-duplication within a
 * discovery session relies on this.
 * </p>
 *
 * <h2>Completeness</h2>
 * <p>
 * A {@code Device} is either complete or not constructed: {@link Builder#build()}
 * rejects any missing component. Instances are immutable.
 * </p>
 *
 * <h2>Mode-dependent fields</h2>
 * <ul>
 *   <li>{@link #colorTemperature()} is meaningful only in {@link ColorMode#COLOR_TEMPERATURE}</li>
 *   <li>{@link #rgb()} is meaningful only in {@link ColorMode#COLOR}</li>
 *   <li>{@link #hue()} and {@link #saturation()} are meaningful only in {@link ColorMode#HSV}</li>
 * </ul>
 * All of them are always parsed and stored.
 *
 * <h2>Connections</h2>
 * <p>
 * A {@code Device} carries no connection state. A control stream is opened
 * separately via {@code DeviceConnector.connect(device)}, which returns its own
 * handle.
 * </p>
 */
public final class Device
{
    private final InetSocketAddress location;
    private final DeviceId id;
    private final String model;
    private final int firmwareVersion;
    private final Set<String> supportedCommands;
    private final PowerStatus power;
    private final int brightness;
    private final ColorMode colorMode;
    private final int colorTemperature;
    private final Rgb rgb;
    private final int hue;
    private final int saturation;
    private final String name;

    private Device(Builder b) {
        this.location = b.location;
        this.id = b.id;
        this.model = b.model;
        this.firmwareVersion = b.firmwareVersion;
        this.supportedCommands = Collections.unmodifiableSet(new LinkedHashSet<>(b.supportedCommands));
        this.power = b.power;
        this.brightness = b.brightness;
        this.colorMode = b.colorMode;
        this.colorTemperature = b.colorTemperature;
        this.rgb = b.rgb;
        this.hue = b.hue;
        this.saturation = b.saturation;
        this.name = b.name;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Network endpoint to contact for control.
     */
    public InetSocketAddress location() {
        return location;
    }

    public DeviceId id() {
        return id;
    }

    public String model() {
        return model;
    }

    public int firmwareVersion() {
        return firmwareVersion;
    }

    /**
     * Capability tokens advertised in {@code support}; iteration order is not significant.
     */
    public Set<String> supportedCommands() {
        return supportedCommands;
    }

    public PowerStatus power() {
        return power;
    }

    public int brightness() {
        return brightness;
    }

    public ColorMode colorMode() {
        return colorMode;
    }

    public int colorTemperature() {
        return colorTemperature;
    }

    public Rgb rgb() {
        return rgb;
    }

    public int hue() {
        return hue;
    }

    public int saturation() {
        return saturation;
    }

    /**
     * User-assigned display name; may be empty.
     */
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Device that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Device{"
                + "id=" + id.value()
                + ", model=" + model
                + ", name='" + name + '\''
                + ", location=" + location
                + ", fwVer=" + firmwareVersion
                + ", power=" + power
                + ", bright=" + brightness
                + ", colorMode=" + colorMode
                + ", ct=" + colorTemperature
                + ", rgb=" + rgb
                + ", hue=" + hue
                + ", sat=" + saturation
                + ", support=" + supportedCommands
                + '}';
    }

    /**
     * Builder for {@link Device}. Every component must be supplied.
     */
    public static final class Builder
    {
        private InetSocketAddress location;
        private DeviceId id;
        private String model;
        private Integer firmwareVersion;
        private Set<String> supportedCommands;
        private PowerStatus power;
        private Integer brightness;
        private ColorMode colorMode;
        private Integer colorTemperature;
        private Rgb rgb;
        private Integer hue;
        private Integer saturation;
        private String name;

        private Builder() {}

        public Builder withLocation(InetSocketAddress location) {
            this.location = location;
            return this;
        }

        public Builder withId(DeviceId id) {
            this.id = id;
            return this;
        }

        public Builder withModel(String model) {
            this.model = model;
            return this;
        }

        public Builder withFirmwareVersion(int firmwareVersion) {
            this.firmwareVersion = requireRange("firmwareVersion", firmwareVersion, 0xFF);
            return this;
        }

        public Builder withSupportedCommands(Set<String> supportedCommands) {
            this.supportedCommands = supportedCommands;
            return this;
        }

        public Builder withPower(PowerStatus power) {
            this.power = power;
            return this;
        }

        public Builder withBrightness(int brightness) {
            this.brightness = requireRange("brightness", brightness, 0xFF);
            return this;
        }

        public Builder withColorMode(ColorMode colorMode) {
            this.colorMode = colorMode;
            return this;
        }

        public Builder withColorTemperature(int colorTemperature) {
            this.colorTemperature = requireRange("colorTemperature", colorTemperature, 0xFFFF);
            return this;
        }

        public Builder withRgb(Rgb rgb) {
            this.rgb = rgb;
            return this;
        }

        public Builder withHue(int hue) {
            this.hue = requireRange("hue", hue, 0xFFFF);
            return this;
        }

        public Builder withSaturation(int saturation) {
            this.saturation = requireRange("saturation", saturation, 0xFF);
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        /**
         * @throws NullPointerException if any component has not been supplied
         */
        public Device build() {
            Objects.requireNonNull(location, "location");
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(model, "model");
            Objects.requireNonNull(firmwareVersion, "firmwareVersion");
            Objects.requireNonNull(supportedCommands, "supportedCommands");
            Objects.requireNonNull(power, "power");
            Objects.requireNonNull(brightness, "brightness");
            Objects.requireNonNull(colorMode, "colorMode");
            Objects.requireNonNull(colorTemperature, "colorTemperature");
            Objects.requireNonNull(rgb, "rgb");
            Objects.requireNonNull(hue, "hue");
            Objects.requireNonNull(saturation, "saturation");
            Objects.requireNonNull(name, "name");
            return new Device(this);
        }

        private static int requireRange(String name, int value, int max) {
            if (value < 0 || value > max) {
                throw new IllegalArgumentException(name + " must be in range 0-" + max + " (was " + value + ")");
            }
            return value;
        }
    }
}
