package com.questrail.lightscan.internal.decode;

import com.questrail.lightscan.model.Device;
import com.questrail.lightscan.model.DeviceId;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.questrail.lightscan.internal.decode.FieldExtractor.require;
import static com.questrail.lightscan.internal.decode.FieldExtractor.requireText;

/**
 * DeviceDecoder
 * ============================================================================
 * Converts the header map of a parsed advertisement into a validated
 * {@link Device}.
 *
 * <h2>Architectural Role</h2>
 * This class forms the boundary between text (header names and raw values) and
 * the typed device model. Collectors and callers operate exclusively on
 * {@link Device} and never reason about wire field names or encodings.
 *
 * <h2>Field order and failure</h2>
 * Fields are read in {@link #FIELDS} order. Decoding is fail-fast: the first
 * missing or invalid field aborts the decode with a {@link DeviceDecodeException}
 * naming that field, and no {@link Device} is produced.
 *
 * <h2>Location</h2>
 * The device location is supplied by the caller (resolved from the datagram),
 * never read from the header map by this class.
 */
public final class DeviceDecoder
{
    public static final String ID = "id";
    public static final String MODEL = "model";
    public static final String FW_VER = "fw_ver";
    public static final String POWER = "power";
    public static final String SUPPORT = "support";
    public static final String BRIGHT = "bright";
    public static final String COLOR_MODE = "color_mode";
    public static final String CT = "ct";
    public static final String RGB = "rgb";
    public static final String HUE = "hue";
    public static final String SAT = "sat";
    public static final String NAME = "name";

    /** Required fields, in decode order. */
    public static final List<String> FIELDS = List.of(
            ID, MODEL, FW_VER, POWER, SUPPORT, BRIGHT, COLOR_MODE, CT, RGB, HUE, SAT, NAME
    );

    /**
     * Decodes one advertisement.
     *
     * @param headers  header map from the parsed response
     * @param location endpoint to record as the device location
     * @return a complete device
     *
     * @throws FieldMissingException if a required field is absent
     * @throws FieldInvalidException if a required field cannot be parsed
     */
    public Device decode(Map<String, String> headers, InetSocketAddress location)
    {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(location, "location");

        return Device.builder()
                .withLocation(location)
                .withId(DeviceId.of(requireText(headers, ID)))
                .withModel(requireText(headers, MODEL))
                .withFirmwareVersion(require(headers, FW_VER, FieldParsers::unsigned8))
                .withPower(require(headers, POWER, FieldParsers::power))
                .withSupportedCommands(require(headers, SUPPORT, FieldParsers::tokens))
                .withBrightness(require(headers, BRIGHT, FieldParsers::unsigned8))
                .withColorMode(require(headers, COLOR_MODE, FieldParsers::colorMode))
                .withColorTemperature(require(headers, CT, FieldParsers::unsigned16))
                .withRgb(require(headers, RGB, FieldParsers::rgb))
                .withHue(require(headers, HUE, FieldParsers::unsigned16))
                .withSaturation(require(headers, SAT, FieldParsers::unsigned8))
                .withName(requireText(headers, NAME))
                .build();
    }
}
