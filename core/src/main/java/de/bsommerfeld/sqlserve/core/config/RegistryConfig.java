package de.bsommerfeld.sqlserve.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Where database files are discovered and where the build snapshot lives.
 * Loaded from the {@code [registry]} section.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryConfig {

    public static final int DEFAULT_HASH_BLOCK_SIZE = 1024 * 1024;

    @JsonProperty("root")
    private String root = ".";

    @JsonProperty("patterns")
    private List<String> patterns = new ArrayList<>(List.of("*.db", "*.sqlite", "*.sqlite3"));

    @JsonProperty("snapshot-file")
    private String snapshotFile = "build-metadata.json";

    @JsonProperty("hash-block-size")
    private int hashBlockSize = DEFAULT_HASH_BLOCK_SIZE;

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    /** The root directory as an absolute, normalized path. */
    public Path rootPath() {
        return Path.of(root).toAbsolutePath().normalize();
    }

    /** The snapshot location, resolved against {@link #rootPath()}. */
    public Path snapshotPath() {
        return rootPath().resolve(snapshotFile);
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns;
    }

    public String getSnapshotFile() {
        return snapshotFile;
    }

    public void setSnapshotFile(String snapshotFile) {
        this.snapshotFile = snapshotFile;
    }

    public int getHashBlockSize() {
        return hashBlockSize;
    }

    public void setHashBlockSize(int hashBlockSize) {
        this.hashBlockSize = hashBlockSize;
    }
}
