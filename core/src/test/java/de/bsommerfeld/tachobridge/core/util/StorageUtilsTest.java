package de.bsommerfeld.tachobridge.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldBeAbsoluteAndNamed() {
        Path dir = StorageUtils.getAppDataDir();

        assertTrue(dir.isAbsolute());
        assertEquals(StorageUtils.APP_NAME, dir.getFileName().toString());
    }

    @Test
    void getAppDataDir_shouldProducePlatformSpecificPath() {
        Path dir = StorageUtils.getAppDataDir();
        String os = System.getProperty("os.name", "").toLowerCase();

        if (os.contains("mac") || os.contains("darwin")) {
            assertTrue(dir.toString().contains("Library/Application Support"));
        } else if (os.contains("win")) {
            assertTrue(dir.toString().contains("AppData") || dir.toString().contains("Roaming"));
        } else {
            String xdg = System.getenv("XDG_DATA_HOME");
            assertTrue(dir.toString().contains(xdg != null && !xdg.isEmpty() ? xdg : ".local/share"));
        }
    }

    @Test
    void files_shouldLiveInAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir();

        assertEquals(appDir.resolve("logs"), StorageUtils.getLogsDir());
        assertEquals(appDir.resolve("config.toml"), StorageUtils.getConfigFile());
        assertEquals(appDir.resolve("credentials.json"), StorageUtils.getCredentialsFile());
        assertEquals(appDir.resolve("cards.json"), StorageUtils.getCardsFile());
    }
}
