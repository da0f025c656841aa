package de.bsommerfeld.mindshare.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Locates the job's log directory under the platform's application data
 * directory:
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/mindshare-leaderboard/logs}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\mindshare-leaderboard\logs}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/mindshare-leaderboard/logs}
 * (fallback {@code ~/.local/share})</li>
 * </ul>
 * The directory is not created here.
 */
public final class StorageUtils {

    public static final String APP_NAME = "mindshare-leaderboard";

    private StorageUtils() {
    }

    /** Absolute directory the rolling file appender in {@code logback.xml} writes to. */
    public static Path logsDir() {
        return appDataDir().resolve("logs").toAbsolutePath();
    }

    private static Path appDataDir() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", APP_NAME);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, APP_NAME)
                    : Paths.get(home, "AppData", "Roaming", APP_NAME);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, APP_NAME)
                : Paths.get(home, ".local", "share", APP_NAME);
    }
}
