package de.bsommerfeld.tachobridge.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldWriteDefaultsWhenFileIsMissing() throws Exception {
        Path file = tempDir.resolve("nested").resolve("config.toml");

        GlobalConfig config = ConfigLoader.load(file);

        assertTrue(Files.exists(file));
        assertEquals("https://api.transportklok.nl", config.getHub().getBaseUrl());
        assertTrue(Files.readString(file).contains("poll-interval-seconds"));
    }

    @Test
    void load_shouldReadSavedValues() throws Exception {
        Path file = tempDir.resolve("config.toml");
        GlobalConfig config = new GlobalConfig();
        config.getHub().setBaseUrl("http://localhost:8080");
        config.getAuthorization().setPollIntervalSeconds(2);
        config.getUser().setLanguage("en");
        ConfigLoader.save(file, config);

        GlobalConfig loaded = ConfigLoader.load(file);

        assertEquals("http://localhost:8080", loaded.getHub().getBaseUrl());
        assertEquals(2, loaded.getAuthorization().getPollIntervalSeconds());
        assertEquals("en", loaded.getUser().getLanguage());
        assertEquals("https://api.trackmijn.nl", loaded.getFleet().getBaseUrl());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, """
                debug-mode = true
                removed-setting = "x"

                [user]
                language = "en"
                theme = "dark"
                """);

        GlobalConfig loaded = ConfigLoader.load(file);

        assertTrue(loaded.isDebugMode());
        assertEquals("en", loaded.getUser().getLanguage());
        assertEquals(5, loaded.getAuthorization().getPollTimeoutMinutes());
    }
}
