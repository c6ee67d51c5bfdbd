package de.bsommerfeld.sqlserve.db;

import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;
import de.bsommerfeld.sqlserve.core.error.NotFoundException;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable name → {@link DatabaseRecord} mapping produced by one registry
 * build. A rebuild produces a new instance; this one never changes.
 */
public final class DatabaseRegistry {

    private final Path root;
    private final Map<String, DatabaseRecord> records;

    public DatabaseRegistry(Path root, Collection<DatabaseRecord> records) {
        this.root = root;
        Map<String, DatabaseRecord> byName = new LinkedHashMap<>();
        for (DatabaseRecord record : records) {
            if (byName.putIfAbsent(record.name(), record) != null) {
                throw new IllegalArgumentException("Duplicate database name: " + record.name());
            }
        }
        this.records = Collections.unmodifiableMap(byName);
    }

    /**
     * @throws NotFoundException if no database is registered under {@code name}
     */
    public DatabaseRecord lookup(String name) {
        DatabaseRecord record = records.get(name);
        if (record == null)
            throw new NotFoundException("Database not found: " + name);
        return record;
    }

    public boolean contains(String name) {
        return records.containsKey(name);
    }

    /** Records in discovery order. */
    public Collection<DatabaseRecord> records() {
        return records.values();
    }

    public int size() {
        return records.size();
    }

    public Path root() {
        return root;
    }

    /** Absolute location of the record's file. */
    public Path pathOf(DatabaseRecord record) {
        return root.resolve(record.file());
    }
}
