package de.bsommerfeld.tachobridge.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where the bridge keeps its files, following each platform's
 * conventions. Paths are absolute but not created; callers create the
 * directories they write to.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/tacho-bridge}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\tacho-bridge} (fallback
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/tacho-bridge} (fallback
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "tacho-bridge";

    private StorageUtils() {
    }

    /** Platform data directory of the bridge. */
    public static Path getAppDataDir() {
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

    public static Path getLogsDir() {
        return getAppDataDir().resolve("logs");
    }

    public static Path getConfigFile() {
        return getAppDataDir().resolve("config.toml");
    }

    /** Token and identifier store; see the {@code store} module. */
    public static Path getCredentialsFile() {
        return getAppDataDir().resolve("credentials.json");
    }

    public static Path getCardsFile() {
        return getAppDataDir().resolve("cards.json");
    }
}
