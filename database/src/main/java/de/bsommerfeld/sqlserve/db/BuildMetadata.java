package de.bsommerfeld.sqlserve.db;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk form of a {@link DatabaseRegistry}, written as JSON:
 *
 * <pre>
 * {
 *   "version" : 1,
 *   "databases" : {
 *     "sales" : { "hash" : "9f86d0...", "file" : "sales.db", "tables" : { "orders" : 120 } }
 *   }
 * }
 * </pre>
 *
 * Bump {@link #CURRENT_VERSION} whenever the shape changes; snapshots with a
 * different version are discarded and the registry is rescanned.
 */
@JsonPropertyOrder({ "version", "databases" })
public record BuildMetadata(int version, Map<String, Entry> databases) {

    public static final int CURRENT_VERSION = 1;

    @JsonPropertyOrder({ "hash", "file", "tables" })
    public record Entry(String hash, String file, Map<String, Long> tables) {
    }

    public static BuildMetadata of(DatabaseRegistry registry) {
        Map<String, Entry> databases = new LinkedHashMap<>();
        for (DatabaseRecord record : registry.records()) {
            databases.put(record.name(), new Entry(record.digest(), record.file(), record.tables()));
        }
        return new BuildMetadata(CURRENT_VERSION, databases);
    }

    /**
     * @throws IllegalArgumentException if an entry lacks its hash or file
     */
    public DatabaseRegistry toRegistry(Path root) {
        List<DatabaseRecord> records = new ArrayList<>();
        if (databases != null) {
            databases.forEach((name, entry) -> {
                if (entry == null || entry.hash() == null || entry.file() == null)
                    throw new IllegalArgumentException("Incomplete snapshot entry for " + name);
                records.add(new DatabaseRecord(name, entry.hash(), entry.file(), entry.tables()));
            });
        }
        return new DatabaseRegistry(root, records);
    }
}
