package com.questrail.lightscan.codec.impl;

import com.questrail.lightscan.codec.ParsedResponse;
import com.questrail.lightscan.codec.ResponseParseException;
import com.questrail.lightscan.codec.ResponseParser;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DefaultResponseParser
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ResponseParser}.
 *
 * <p>This parser performs the following steps, in order:</p>
 * <ol>
 *   <li>Lossy UTF-8 decoding (malformed sequences become U+FFFD)</li>
 *   <li>Trimming of leading whitespace and trailing NUL padding / whitespace</li>
 *   <li>Status line validation ({@code HTTP/1.x NNN reason})</li>
 *   <li>Header line parsing up to {@link #MAX_HEADERS} lines</li>
 * </ol>
 *
 * <p>Lines may end in CRLF or a bare LF. An empty line ends the header block and
 * anything after it is ignored; reaching the end of the input also ends it, since
 * lights do not always terminate the header block.</p>
 */
public final class DefaultResponseParser implements ResponseParser
{
    /** Maximum number of header lines accepted in one response. */
    public static final int MAX_HEADERS = 17;

    private static final Pattern STATUS_LINE = Pattern.compile("HTTP/1\\.\\d (\\d{3})(?: (.*))?");
    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    /** Separators and token characters per RFC 7230 §3.2.6. */
    private static final String TOKEN_SYMBOLS = "!#$%&'*+-.^_`|~";

    @Override
    public ParsedResponse parse(byte[] datagram)
    {
        Objects.requireNonNull(datagram, "datagram");

        final String text = trim(new String(datagram, StandardCharsets.UTF_8));
        if (text.isEmpty()) {
            throw new ResponseParseException("Empty datagram");
        }

        final String[] lines = LINE_BREAK.split(text, -1);

        // 1) Status line
        final Matcher status = STATUS_LINE.matcher(lines[0]);
        if (!status.matches()) {
            throw new ResponseParseException("Malformed status line: " + abbreviate(lines[0]));
        }
        final int statusCode = Integer.parseInt(status.group(1));
        final String reason = status.group(2) == null ? "" : status.group(2);

        // 2) Header lines
        final Map<String, String> headers = new LinkedHashMap<>();
        int headerCount = 0;
        for (int i = 1; i < lines.length; i++) {
            final String line = lines[i];
            if (line.isEmpty()) {
                break;
            }
            if (++headerCount > MAX_HEADERS) {
                throw new ResponseParseException("Too many headers (limit " + MAX_HEADERS + ")");
            }

            final int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new ResponseParseException("Malformed header line: " + abbreviate(line));
            }
            final String name = line.substring(0, colon);
            if (!isToken(name)) {
                throw new ResponseParseException("Invalid header name: " + abbreviate(name));
            }
            headers.put(name, stripOws(line.substring(colon + 1)));
        }

        return new ParsedResponse(statusCode, reason, headers);
    }

    /**
     * Strips leading whitespace, and trailing whitespace and NUL padding left
     * over from a fixed-size receive buffer.
     */
    static String trim(String text)
    {
        int start = 0;
        int end = text.length();
        while (start < end && isPadding(text.charAt(start))) {
            start++;
        }
        while (end > start && isPadding(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isPadding(char c)
    {
        return c == '\0' || Character.isWhitespace(c);
    }

    private static String stripOws(String value)
    {
        int start = 0;
        int end = value.length();
        while (start < end && isOws(value.charAt(start))) {
            start++;
        }
        while (end > start && isOws(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isOws(char c)
    {
        return c == ' ' || c == '\t';
    }

    private static boolean isToken(String name)
    {
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            final boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alnum && TOKEN_SYMBOLS.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    private static String abbreviate(String s)
    {
        return s.length() <= 64 ? "'" + s + "'" : "'" + s.substring(0, 64) + "...'";
    }
}
