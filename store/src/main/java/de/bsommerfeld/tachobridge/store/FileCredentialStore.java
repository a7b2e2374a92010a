package de.bsommerfeld.tachobridge.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.core.domain.CredentialKey;
import de.bsommerfeld.tachobridge.core.util.StorageUtils;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link CredentialStore} backed by a flat JSON object of string values,
 * {@code credentials.json} in the platform data directory.
 *
 * <pre>{@code
 * {
 *   "device_token" : "...",
 *   "bridge_client_identifier" : "TBA0123456789012"
 * }
 * }</pre>
 *
 * Unknown keys are dropped on the next write. An unreadable file is moved
 * aside and the store starts empty.
 */
@Singleton
public class FileCredentialStore extends MapBackedCredentialStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileCredentialStore.class);
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public FileCredentialStore() {
        this(StorageUtils.getCredentialsFile());
    }

    public FileCredentialStore(Path file) {
        this.file = file;
    }

    @Override
    protected Map<CredentialKey, String> readAll() {
        Map<CredentialKey, String> values = new EnumMap<>(CredentialKey.class);
        if (!Files.exists(file)) {
            LOG.info("No credential file at {}, starting fresh", file);
            return values;
        }

        try {
            Map<String, String> raw = mapper.readValue(file.toFile(), STRING_MAP);
            for (Map.Entry<String, String> entry : raw.entrySet()) {
                CredentialKey key = CredentialKey.fromStorageKey(entry.getKey());
                if (key == null) {
                    LOG.debug("Skipping unknown credential key '{}'", entry.getKey());
                } else if (entry.getValue() != null && !entry.getValue().isBlank()) {
                    values.put(key, entry.getValue());
                }
            }
            LOG.debug("Loaded credentials {} from {}", values.keySet(), file);
        } catch (IOException e) {
            LOG.error("Credential file {} is unreadable, moving it aside", file, e);
            try {
                JsonFiles.quarantine(file);
            } catch (IOException moveFailure) {
                throw new StoreException("Cannot move unreadable credential file " + file, moveFailure);
            }
        }
        return values;
    }

    @Override
    protected void persist(Map<CredentialKey, String> snapshot) {
        Map<String, String> raw = new LinkedHashMap<>();
        snapshot.forEach((key, value) -> raw.put(key.storageKey(), value));
        try {
            JsonFiles.writeAtomically(mapper, file, raw);
        } catch (IOException e) {
            throw new StoreException("Failed to write credentials to " + file, e);
        }
    }
}
