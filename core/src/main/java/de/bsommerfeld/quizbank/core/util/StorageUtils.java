package de.bsommerfeld.quizbank.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the per-user application data directory following each
 * platform's convention. Paths are absolute but not created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}, falling back to
 * {@code ~/AppData/Roaming}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}}, falling back
 * to {@code ~/.local/share}</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "quizbank";

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
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(home, ".local", "share", appName);
    }

    /**
     * Location of config.toml. The {@code quizbank.config} system property
     * overrides the default {@code {appDataDir}/config.toml}.
     */
    public static Path getConfigFile(String appName) {
        String override = System.getProperty("quizbank.config");
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }
        return getAppDataDir(appName).resolve("config.toml");
    }
}
