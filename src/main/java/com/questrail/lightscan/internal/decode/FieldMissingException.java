package com.questrail.lightscan.internal.decode;

/**
 * A required advertisement field is absent.
 */
public final class FieldMissingException extends DeviceDecodeException
{
    public FieldMissingException(String field) {
        super(field, "Missing field '" + field + "'");
    }
}
