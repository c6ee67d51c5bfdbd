package de.bsommerfeld.sqlserve.server.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Form-decoded query string. The first occurrence of a repeated key wins;
 * pairs with a malformed escape are skipped.
 */
public final class QueryParameters {

    private static final Logger LOG = LoggerFactory.getLogger(QueryParameters.class);

    private final Map<String, String> values;

    private QueryParameters(Map<String, String> values) {
        this.values = values;
    }

    public static QueryParameters parse(String rawQuery) {
        Map<String, String> values = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty())
            return new QueryParameters(values);

        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty())
                continue;
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            try {
                values.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                        URLDecoder.decode(value, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                LOG.debug("Skipping malformed query parameter '{}': {}", pair, e.getMessage());
            }
        }
        return new QueryParameters(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
}
