package de.bsommerfeld.tachobridge.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@code config.toml}.
 *
 * <p>
 * A missing file is not an error: the defaults of {@link GlobalConfig} are
 * written to disk on first start so the user has a complete file to edit.
 * Unknown keys are ignored so older builds can read newer files.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, creating it with defaults when
     * it does not exist yet.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static GlobalConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No configuration found at {}, writing defaults", path);
            GlobalConfig defaults = new GlobalConfig();
            save(path, defaults);
            return defaults;
        }
        return MAPPER.readValue(path.toFile(), GlobalConfig.class);
    }

    /** Writes the configuration, creating parent directories as needed. */
    public static void save(Path path, GlobalConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
