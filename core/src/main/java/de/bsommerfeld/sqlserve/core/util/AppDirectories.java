package de.bsommerfeld.sqlserve.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Per-user data and log directories for the server process, following each
 * platform's convention:
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{app}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{app}}, else
 * {@code ~/AppData/Roaming/{app}}</li>
 * <li><strong>other</strong>: {@code $XDG_DATA_HOME/{app}}, else
 * {@code ~/.local/share/{app}}</li>
 * </ul>
 * Paths are resolved, never created.
 */
public final class AppDirectories {

    public static final String APP_NAME = "sqlserve";

    private final String osName;
    private final String userHome;
    private final Map<String, String> env;

    AppDirectories(String osName, String userHome, Map<String, String> env) {
        this.osName = osName.toLowerCase(Locale.ENGLISH);
        this.userHome = userHome;
        this.env = env;
    }

    /** Directories for the running JVM's platform and user. */
    public static AppDirectories system() {
        return new AppDirectories(System.getProperty("os.name", "generic"),
                System.getProperty("user.home"), System.getenv());
    }

    public Path dataDir(String appName) {
        if (osName.contains("mac") || osName.contains("darwin"))
            return Paths.get(userHome, "Library", "Application Support", appName);
        if (osName.contains("win")) {
            String appData = env.get("APPDATA");
            return appData != null ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName);
        }
        String xdgData = env.get("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty() ? Paths.get(xdgData, appName)
                : Paths.get(userHome, ".local", "share", appName);
    }

    public Path logsDir(String appName) {
        return dataDir(appName).resolve("logs");
    }
}
