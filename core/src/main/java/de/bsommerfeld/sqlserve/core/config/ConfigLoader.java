package de.bsommerfeld.sqlserve.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ServeConfig} from a TOML file. Keys absent from the file keep
 * the defaults declared on the config classes; a missing file means all
 * defaults.
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "sqlserve.toml";

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /**
     * @throws UncheckedIOException if the file exists but cannot be read or
     *                              parsed
     */
    public static ServeConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            LOG.info("No configuration at {}, using defaults", file.toAbsolutePath());
            return new ServeConfig();
        }
        LOG.info("Loading configuration from {}", file.toAbsolutePath());
        try {
            return MAPPER.readValue(file.toFile(), ServeConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration " + file, e);
        }
    }
}
