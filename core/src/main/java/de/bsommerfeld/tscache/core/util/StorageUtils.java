package de.bsommerfeld.tscache.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the OS-specific application data directory that holds the
 * snapshot database, {@code config.toml} and context definitions. Paths are
 * absolute but <strong>not</strong> created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "tscache";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName).toAbsolutePath();
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName).toAbsolutePath()
                    : Paths.get(home, "AppData", "Roaming", appName).toAbsolutePath();
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName).toAbsolutePath();
        }
        return Paths.get(home, ".local", "share", appName).toAbsolutePath();
    }
}
