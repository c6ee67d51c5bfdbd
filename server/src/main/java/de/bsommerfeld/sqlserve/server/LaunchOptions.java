package de.bsommerfeld.sqlserve.server;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed command line:
 * {@code [--config <file>] [--root <dir>] [--port <n>] [--build]}.
 *
 * @param config file to load, the default config name when absent
 * @param root   overrides {@code [registry] root}
 * @param port   overrides {@code [server] port}
 * @param build  rebuild the registry and exit instead of serving
 */
public record LaunchOptions(Optional<Path> config, Optional<String> root, Optional<Integer> port, boolean build) {

    public static final String USAGE = "usage: sqlserve [--config <file>] [--root <dir>] [--port <n>] [--build]";

    /**
     * @throws IllegalArgumentException on an unknown argument, a missing
     *                                  option value or a non-numeric port
     */
    public static LaunchOptions parse(String... args) {
        List<String> remaining = new ArrayList<>(List.of(args));

        boolean build = remaining.remove("--build");
        Optional<Path> config = pluckOption(remaining, "--config").map(Paths::get);
        Optional<String> root = pluckOption(remaining, "--root");
        Optional<Integer> port = pluckOption(remaining, "--port").map(LaunchOptions::parsePort);

        if (!remaining.isEmpty())
            throw new IllegalArgumentException("Unexpected argument(s): " + remaining);
        return new LaunchOptions(config, root, port, build);
    }

    private static Optional<String> pluckOption(List<String> remaining, String option) {
        int index = remaining.indexOf(option);
        if (index < 0)
            return Optional.empty();
        remaining.remove(index);
        if (index >= remaining.size())
            throw new IllegalArgumentException("Missing value for " + option);
        return Optional.of(remaining.remove(index));
    }

    private static int parsePort(String value) {
        try {
            int port = Integer.parseInt(value);
            if (port < 0 || port > 65535)
                throw new IllegalArgumentException("Port out of range: " + value);
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value, e);
        }
    }
}
