package de.bsommerfeld.sqlserve.server.http;

import de.bsommerfeld.sqlserve.core.error.NotFoundException;
import de.bsommerfeld.sqlserve.db.CompoundKeyCodec;
import de.bsommerfeld.sqlserve.db.PathSegments;

/**
 * A request path split into its addressable parts.
 *
 * <p>
 * The raw path is split on {@code /} before any decoding, so an escaped slash
 * ({@code %2F}) stays inside its segment. Database and table segments are then
 * percent-decoded; the primary-key segment is kept raw for
 * {@link CompoundKeyCodec}. A trailing {@code .json} on the last segment is
 * accepted and dropped.
 *
 * @param database decoded database segment, null for the index
 * @param table    decoded table name, null above table level
 * @param pkPath   raw primary-key segment, null above row level
 */
public record RequestPath(Kind kind, String database, String table, String pkPath) {

    public enum Kind {
        INDEX, FAVICON, DATABASE, TABLE, ROW
    }

    private static final String JSON_SUFFIX = ".json";
    private static final String FAVICON = "favicon.ico";

    /**
     * @throws NotFoundException if the path has more than three segments, an
     *                           empty segment or a malformed escape
     */
    public static RequestPath parse(String rawPath) {
        String path = rawPath == null ? "" : rawPath;
        if (path.startsWith("/"))
            path = path.substring(1);
        if (path.isEmpty())
            return new RequestPath(Kind.INDEX, null, null, null);
        if (path.equals(FAVICON))
            return new RequestPath(Kind.FAVICON, null, null, null);

        String[] segments = path.split("/", -1);
        if (segments.length > 3)
            throw notFound(rawPath);
        int last = segments.length - 1;
        if (segments[last].endsWith(JSON_SUFFIX))
            segments[last] = segments[last].substring(0, segments[last].length() - JSON_SUFFIX.length());
        for (String segment : segments) {
            if (segment.isEmpty())
                throw notFound(rawPath);
        }

        try {
            String database = PathSegments.decode(segments[0]);
            if (segments.length == 1)
                return new RequestPath(Kind.DATABASE, database, null, null);
            String table = PathSegments.decode(segments[1]);
            if (segments.length == 2)
                return new RequestPath(Kind.TABLE, database, table, null);
            CompoundKeyCodec.decode(segments[2]);
            return new RequestPath(Kind.ROW, database, table, segments[2]);
        } catch (IllegalArgumentException e) {
            throw notFound(rawPath);
        }
    }

    private static NotFoundException notFound(String rawPath) {
        return new NotFoundException("Not found: " + rawPath);
    }
}
