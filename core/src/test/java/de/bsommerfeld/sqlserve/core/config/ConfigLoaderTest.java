package de.bsommerfeld.sqlserve.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnDefaultsForMissingFile() {
        ServeConfig config = ConfigLoader.load(tempDir.resolve("absent.toml"));

        assertEquals("0.0.0.0", config.getServer().getHost());
        assertEquals(8006, config.getServer().getPort());
        assertEquals(20, config.getServer().getTableRowLimit());
        assertEquals(1000, config.getServer().getQueryRowLimit());
        assertEquals(ServerConfig.DEFAULT_CACHE_MAX_AGE, config.getServer().getCacheMaxAgeSeconds());
        assertEquals(List.of("*.db", "*.sqlite", "*.sqlite3"), config.getRegistry().getPatterns());
        assertEquals("build-metadata.json", config.getRegistry().getSnapshotFile());
        assertEquals(1024 * 1024, config.getRegistry().getHashBlockSize());
    }

    @Test
    void load_shouldOverrideOnlyPresentKeys() throws IOException {
        Path file = tempDir.resolve("sqlserve.toml");
        Files.writeString(file, """
                [server]
                port = 9000
                table-row-limit = 5
                query-row-limit = 0

                [registry]
                root = "/srv/data"
                patterns = ["*.db"]
                """);

        ServeConfig config = ConfigLoader.load(file);

        assertEquals(9000, config.getServer().getPort());
        assertEquals(5, config.getServer().getTableRowLimit());
        assertEquals(0, config.getServer().getQueryRowLimit());
        assertEquals("0.0.0.0", config.getServer().getHost());
        assertEquals("/srv/data", config.getRegistry().getRoot());
        assertEquals(List.of("*.db"), config.getRegistry().getPatterns());
        assertEquals("build-metadata.json", config.getRegistry().getSnapshotFile());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws IOException {
        Path file = tempDir.resolve("sqlserve.toml");
        Files.writeString(file, """
                legacy = true

                [server]
                port = 8100
                colour = "blue"
                """);

        assertEquals(8100, ConfigLoader.load(file).getServer().getPort());
    }

    @Test
    void load_shouldFailOnMalformedFile() throws IOException {
        Path file = tempDir.resolve("broken.toml");
        Files.writeString(file, "[server\nport = ");

        assertThrows(UncheckedIOException.class, () -> ConfigLoader.load(file));
    }

    @Test
    void registryConfig_shouldResolveSnapshotAgainstRoot() {
        RegistryConfig registry = new RegistryConfig();
        registry.setRoot(tempDir.toString());

        assertEquals(tempDir.toAbsolutePath().normalize().resolve("build-metadata.json"), registry.snapshotPath());
    }
}
