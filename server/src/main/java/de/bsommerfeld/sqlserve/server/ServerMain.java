package de.bsommerfeld.sqlserve.server;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.sqlserve.core.config.ConfigLoader;
import de.bsommerfeld.sqlserve.core.config.ServeConfig;
import de.bsommerfeld.sqlserve.core.util.AppDirectories;
import de.bsommerfeld.sqlserve.db.ConnectionCache;
import de.bsommerfeld.sqlserve.db.DatabaseRegistry;
import de.bsommerfeld.sqlserve.db.MetadataRegistry;
import de.bsommerfeld.sqlserve.server.http.ServeHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point. Either rebuilds the registry and exits ({@code --build}) or
 * loads it once and serves until the process is killed.
 */
public final class ServerMain {

    static {
        Path logDir = AppDirectories.system().logsDir(AppDirectories.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ServerMain.class);

    private ServerMain() {
    }

    public static void main(String[] args) {
        LaunchOptions options;
        try {
            options = LaunchOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(LaunchOptions.USAGE);
            System.exit(2);
            return;
        }
        System.exit(run(options));
    }

    /**
     * @return the process exit code; only returns in {@code --build} mode or
     *         on a startup failure
     */
    static int run(LaunchOptions options) {
        ServeConfig config = ConfigLoader.load(options.config().orElse(Paths.get(ConfigLoader.DEFAULT_FILE_NAME)));
        options.root().ifPresent(config.getRegistry()::setRoot);
        options.port().ifPresent(config.getServer()::setPort);

        Injector injector = Guice.createInjector(new ServeModule(config));
        MetadataRegistry registry = injector.getInstance(MetadataRegistry.class);

        if (options.build()) {
            try {
                DatabaseRegistry built = registry.build(true);
                LOG.info("Built metadata for {} database(s) in {}", built.size(), built.root());
                return 0;
            } catch (RuntimeException e) {
                LOG.error("Build failed", e);
                return 1;
            }
        }

        ServeHttpServer server = injector.getInstance(ServeHttpServer.class);
        ConnectionCache connections = injector.getInstance(ConnectionCache.class);
        try {
            DatabaseRegistry loaded = registry.build(false);
            LOG.info("Loaded {} database(s) from {}", loaded.size(), loaded.root());
            server.start();
        } catch (IOException | RuntimeException e) {
            LOG.error("Startup failed", e);
            return 1;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            server.stop();
            connections.close();
        }, "sqlserve-shutdown"));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }
}
