package de.bsommerfeld.sqlserve.db;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Packs a row's primary-key values into one URL path segment and back.
 *
 * <p>
 * Values are form-encoded (space becomes {@code +}, reserved characters
 * become {@code %XX}) and joined with commas, in primary-key declaration
 * order as reported by {@link SchemaIntrospector#primaryKeyColumns}. Encoding
 * escapes a comma inside a value as {@code %2C}. A raw comma typed into a URL
 * always separates two values; there is no way to smuggle an unescaped comma
 * into a single value.
 */
public final class CompoundKeyCodec {

    private static final char SEPARATOR = ',';

    private CompoundKeyCodec() {
    }

    /**
     * Encodes the row's values for {@code pkColumns}, in that order.
     *
     * @throws IllegalArgumentException if a key column is missing from the
     *                                  row, holds {@code null} or holds a
     *                                  blob, which has no text form that
     *                                  binds back to the same value
     */
    public static String encode(Map<String, ?> row, List<String> pkColumns) {
        List<Object> values = new ArrayList<>(pkColumns.size());
        for (String column : pkColumns) {
            Object value = row.get(column);
            if (value == null)
                throw new IllegalArgumentException("No value for primary key column " + column);
            if (value instanceof byte[])
                throw new IllegalArgumentException("Blob value in primary key column " + column);
            values.add(value);
        }
        return encode(values);
    }

    /**
     * Encodes already-ordered key values.
     *
     * @throws IllegalArgumentException if a value is a blob
     */
    public static String encode(List<?> values) {
        StringBuilder segment = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) instanceof byte[])
                throw new IllegalArgumentException("Blob value at key position " + i);
            if (i > 0)
                segment.append(SEPARATOR);
            segment.append(URLEncoder.encode(String.valueOf(values.get(i)), StandardCharsets.UTF_8));
        }
        return segment.toString();
    }

    /**
     * Splits {@code segment} on raw commas and decodes each part. Empty parts
     * are kept, so {@code "a,,b"} yields three values.
     *
     * @throws IllegalArgumentException on a malformed {@code %} escape
     */
    public static List<String> decode(String segment) {
        List<String> values = new ArrayList<>();
        int start = 0;
        while (true) {
            int comma = segment.indexOf(SEPARATOR, start);
            String part = comma < 0 ? segment.substring(start) : segment.substring(start, comma);
            values.add(URLDecoder.decode(part, StandardCharsets.UTF_8));
            if (comma < 0)
                return values;
            start = comma + 1;
        }
    }
}
