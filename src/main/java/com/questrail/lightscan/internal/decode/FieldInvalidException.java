package com.questrail.lightscan.internal.decode;

import java.util.Objects;

/**
 * A required advertisement field is present but cannot be parsed into its
 * target type.
 */
public final class FieldInvalidException extends DeviceDecodeException
{
    private final String rawValue;

    public FieldInvalidException(String field, String rawValue) {
        super(field, message(field, rawValue));
        this.rawValue = Objects.requireNonNull(rawValue, "rawValue");
    }

    public FieldInvalidException(String field, String rawValue, Throwable cause) {
        super(field, message(field, rawValue), cause);
        this.rawValue = Objects.requireNonNull(rawValue, "rawValue");
    }

    /**
     * Returns the value exactly as it appeared in the advertisement.
     */
    public String rawValue() {
        return rawValue;
    }

    private static String message(String field, String rawValue) {
        return "Invalid value for field '" + field + "': '" + rawValue + "'";
    }
}
