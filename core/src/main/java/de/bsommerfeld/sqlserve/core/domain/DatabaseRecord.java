package de.bsommerfeld.sqlserve.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One discovered database file as seen at registry build time.
 *
 * @param name   file stem, unique within a registry
 * @param digest hex SHA-256 of the whole file
 * @param file   file name relative to the registry root
 * @param tables user tables in {@code sqlite_master} order, mapped to their
 *               row count at scan time
 */
public record DatabaseRecord(String name, String digest, String file, Map<String, Long> tables) {

    public static final int HASH_PREFIX_LENGTH = 7;

    public DatabaseRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(file, "file");
        if (digest.length() < HASH_PREFIX_LENGTH)
            throw new IllegalArgumentException("Digest too short for " + name + ": " + digest);
        tables = tables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    /** First seven hex characters of the digest, the URL freshness token. */
    public String hashPrefix() {
        return digest.substring(0, HASH_PREFIX_LENGTH);
    }

    public boolean hasTable(String table) {
        return tables.containsKey(table);
    }
}
