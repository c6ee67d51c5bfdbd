package de.bsommerfeld.sqlserve.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sqlserve.core.config.RegistryConfig;
import de.bsommerfeld.sqlserve.core.domain.DatabaseRecord;
import de.bsommerfeld.sqlserve.core.error.DatabaseAccessException;
import de.bsommerfeld.sqlserve.core.error.DuplicateNameException;
import de.bsommerfeld.sqlserve.core.error.NotFoundException;
import de.bsommerfeld.sqlserve.core.hash.ContentFingerprinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Discovers the database files under the configured root and keeps the
 * current {@link DatabaseRegistry}.
 *
 * <h3>Lifecycle</h3>
 * <ul>
 * <li>{@code build(false)} returns the registry already loaded in this
 * process, else trusts the persisted snapshot verbatim, else scans.</li>
 * <li>{@code build(true)} always rescans: every file is re-hashed and
 * re-introspected, then the snapshot is rewritten.</li>
 * </ul>
 * A snapshot is trusted without checking file sizes or timestamps, so files
 * replaced between restarts stay invisible until the next forced build.
 *
 * <h3>Threading model</h3>
 * Builds are serialized on this instance. Readers never block: they read a
 * volatile reference that is only swapped once a complete registry exists.
 * A failed build leaves the previous registry in place.
 */
@Singleton
public class MetadataRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataRegistry.class);

    private final Path root;
    private final List<String> patterns;
    private final Path snapshotFile;
    private final ContentFingerprinter fingerprinter;
    private final SchemaIntrospector introspector;
    private final BuildMetadataStore store;

    private volatile DatabaseRegistry current;

    @Inject
    public MetadataRegistry(RegistryConfig config) {
        this(config, new SchemaIntrospector(), new BuildMetadataStore());
    }

    MetadataRegistry(RegistryConfig config, SchemaIntrospector introspector, BuildMetadataStore store) {
        this.root = config.rootPath();
        this.patterns = List.copyOf(config.getPatterns());
        this.snapshotFile = config.snapshotPath();
        this.fingerprinter = new ContentFingerprinter(config.getHashBlockSize());
        this.introspector = introspector;
        this.store = store;
    }

    /**
     * Builds (or reuses) the registry and publishes it as {@link #current()}.
     *
     * @param force rescan and re-hash every file even if a registry or
     *              snapshot is available
     * @throws DuplicateNameException  if two files share a stem
     * @throws DatabaseAccessException if a file cannot be hashed or
     *                                 introspected, or the snapshot cannot be
     *                                 written
     */
    public synchronized DatabaseRegistry build(boolean force) {
        if (!force) {
            DatabaseRegistry loaded = current;
            if (loaded != null)
                return loaded;
            Optional<DatabaseRegistry> restored = restoreSnapshot();
            if (restored.isPresent()) {
                current = restored.get();
                LOG.info("Loaded {} database(s) from snapshot {}", current.size(), snapshotFile);
                return current;
            }
        }

        DatabaseRegistry scanned = scan();
        persist(scanned);
        current = scanned;
        return scanned;
    }

    /**
     * Returns the published registry, building it on first access.
     */
    public DatabaseRegistry current() {
        DatabaseRegistry loaded = current;
        return loaded != null ? loaded : build(false);
    }

    /**
     * @throws NotFoundException if {@code name} is not in the current registry
     */
    public DatabaseRecord lookup(String name) {
        return current().lookup(name);
    }

    private Optional<DatabaseRegistry> restoreSnapshot() {
        try {
            return store.read(snapshotFile).map(metadata -> metadata.toRegistry(root));
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring inconsistent snapshot {}: {}", snapshotFile, e.getMessage());
            return Optional.empty();
        }
    }

    private DatabaseRegistry scan() {
        Map<String, Path> files = discover();
        LOG.info("Building registry for {} database file(s) in {}", files.size(), root);

        List<DatabaseRecord> records = new ArrayList<>(files.size());
        for (Map.Entry<String, Path> entry : files.entrySet()) {
            records.add(describe(entry.getKey(), entry.getValue()));
        }
        return new DatabaseRegistry(root, records);
    }

    /**
     * Maps each stem to its file, patterns in configured order and files
     * sorted by name within a pattern. A file matched by several patterns
     * counts once.
     */
    private Map<String, Path> discover() {
        Map<String, Path> byStem = new LinkedHashMap<>();
        for (String pattern : patterns) {
            for (Path file : list(pattern)) {
                String stem = stemOf(file);
                Path existing = byStem.putIfAbsent(stem, file);
                if (existing != null && !existing.equals(file)) {
                    throw new DuplicateNameException(stem, existing, file);
                }
            }
        }
        return byStem;
    }

    private List<Path> list(String pattern) {
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, pattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path))
                    matches.add(path);
            }
        } catch (IOException e) {
            throw new DatabaseAccessException("Failed to list " + pattern + " in " + root, e);
        }
        matches.sort(null);
        return matches;
    }

    private DatabaseRecord describe(String name, Path file) {
        String digest;
        try {
            digest = fingerprinter.fingerprint(file);
        } catch (IOException e) {
            throw new DatabaseAccessException("Failed to hash " + file, e);
        }

        Map<String, Long> tables;
        try {
            tables = introspector.introspect(file);
        } catch (SQLException e) {
            throw new DatabaseAccessException("Failed to introspect " + file, e);
        }

        LOG.info("Registered {} ({}, {} table(s), sha256 {})", name, file.getFileName(), tables.size(), digest);
        return new DatabaseRecord(name, digest, file.getFileName().toString(), tables);
    }

    private void persist(DatabaseRegistry registry) {
        try {
            store.write(snapshotFile, BuildMetadata.of(registry));
        } catch (IOException e) {
            throw new DatabaseAccessException("Failed to write snapshot " + snapshotFile, e);
        }
    }

    /** {@code sales.sqlite3} → {@code sales}; names without a dot are kept whole. */
    static String stemOf(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
