package com.questrail.lightscan.internal.decode;

import java.util.Objects;

/**
 * Indicates that a parsed advertisement could not be translated into a
 * valid {@link com.questrail.lightscan.model.Device}.
 *
 * The failure is always attributed to a single named field:
 * <ul>
 *   <li>{@link FieldMissingException}: the field is absent</li>
 *   <li>{@link FieldInvalidException}: the field is present but unparseable</li>
 * </ul>
 */
public abstract class DeviceDecodeException extends RuntimeException
{
    private final String field;

    protected DeviceDecodeException(String field, String message) {
        super(message);
        this.field = Objects.requireNonNull(field, "field");
    }

    protected DeviceDecodeException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = Objects.requireNonNull(field, "field");
    }

    /**
     * Returns the wire name of the offending field (for example {@code fw_ver}).
     */
    public String field() {
        return field;
    }
}
