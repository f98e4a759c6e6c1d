package de.bsommerfeld.layerkit.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Locates per-user application directories following each platform's
 * conventions. Nothing here creates directories; callers do that when they
 * write.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{app}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{app}}, falling back to
 * {@code ~/AppData/Roaming/{app}}</li>
 * <li><strong>Other</strong>: {@code $XDG_DATA_HOME/{app}}, falling back to
 * {@code ~/.local/share/{app}}</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "layerkit";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName)
                : Paths.get(home, ".local", "share", appName);
    }

    /** {@code {appDataDir}/logs}, read by the logback configuration as {@code LOG_DIR}. */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /** {@code {appDataDir}/config.toml}. */
    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }

    /** {@code {appDataDir}/session.json}, the persisted login session. */
    public static Path getSessionFile(String appName) {
        return getAppDataDir(appName).resolve("session.json");
    }
}
