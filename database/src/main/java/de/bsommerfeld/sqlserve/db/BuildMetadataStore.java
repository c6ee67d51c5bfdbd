package de.bsommerfeld.sqlserve.db;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes the {@link BuildMetadata} snapshot. Writes go to a sibling
 * temp file first and are moved into place, so a reader never sees a
 * half-written snapshot.
 */
public class BuildMetadataStore {

    private static final Logger LOG = LoggerFactory.getLogger(BuildMetadataStore.class);

    private final ObjectMapper mapper;

    public BuildMetadataStore() {
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Returns the snapshot at {@code file}, or empty if there is none or it
     * cannot be used (unparseable, or written by a different schema version).
     */
    public Optional<BuildMetadata> read(Path file) {
        if (!Files.isRegularFile(file))
            return Optional.empty();
        try {
            BuildMetadata metadata = mapper.readValue(file.toFile(), BuildMetadata.class);
            if (metadata.version() != BuildMetadata.CURRENT_VERSION) {
                LOG.warn("Ignoring snapshot {} with version {} (expected {})",
                        file, metadata.version(), BuildMetadata.CURRENT_VERSION);
                return Optional.empty();
            }
            return Optional.of(metadata);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Ignoring unreadable snapshot {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws IOException if the snapshot cannot be written
     */
    public void write(Path file, BuildMetadata metadata) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), metadata);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        LOG.debug("Snapshot written to {}", file);
    }
}
