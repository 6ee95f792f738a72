package com.questrail.lightscan.internal.decode;

import java.util.Map;
import java.util.Objects;

/**
 * FieldExtractor
 * -----------------------------------------------------------------------------
 * Looks up one named field in a header map and converts it with a
 * {@link FieldParser}, attributing any failure to that field.
 *
 * <p>Every field of an advertisement goes through {@link #require}, so the
 * missing/invalid distinction is made in exactly one place.</p>
 */
final class FieldExtractor
{
    /**
     * Converts the raw text of a field into its target type.
     *
     * <p>Implementations signal an unparseable value by throwing
     * {@link IllegalArgumentException} (which includes
     * {@link NumberFormatException}).</p>
     */
    @FunctionalInterface
    interface FieldParser<T> {
        T parse(String raw);
    }

    private FieldExtractor() {}

    /**
     * @throws FieldMissingException if {@code field} is absent from {@code headers}
     * @throws FieldInvalidException if {@code parser} rejects the value
     */
    static <T> T require(Map<String, String> headers, String field, FieldParser<T> parser)
    {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(parser, "parser");

        final String raw = headers.get(field);
        if (raw == null) {
            throw new FieldMissingException(field);
        }

        try {
            return parser.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new FieldInvalidException(field, raw, e);
        }
    }

    /**
     * Returns the field verbatim.
     */
    static String requireText(Map<String, String> headers, String field)
    {
        return require(headers, field, raw -> raw);
    }
}
