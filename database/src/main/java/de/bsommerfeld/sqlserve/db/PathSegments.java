package de.bsommerfeld.sqlserve.db;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Percent-coding for database and table segments of a URL path. Unlike form
 * coding a {@code +} is a literal plus sign and a space is {@code %20}.
 * Primary-key segments use {@link CompoundKeyCodec} instead.
 */
public final class PathSegments {

    private PathSegments() {
    }

    public static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * @throws IllegalArgumentException on a malformed {@code %} escape
     */
    public static String decode(String rawSegment) {
        return URLDecoder.decode(rawSegment.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}
