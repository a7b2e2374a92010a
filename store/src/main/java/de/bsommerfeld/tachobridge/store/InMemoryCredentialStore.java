package de.bsommerfeld.tachobridge.store;

import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.core.domain.CredentialKey;

import java.util.EnumMap;
import java.util.Map;

/**
 * {@link CredentialStore} for TEST mode. Values live for the lifetime of
 * the process only.
 */
@Singleton
public class InMemoryCredentialStore extends MapBackedCredentialStore {

    private final Map<CredentialKey, String> initial;

    public InMemoryCredentialStore() {
        this(Map.of());
    }

    /** Starts from pre-seeded values, as if they had been persisted earlier. */
    public InMemoryCredentialStore(Map<CredentialKey, String> initial) {
        this.initial = new EnumMap<>(CredentialKey.class);
        this.initial.putAll(initial);
    }

    @Override
    protected Map<CredentialKey, String> readAll() {
        return initial;
    }

    @Override
    protected void persist(Map<CredentialKey, String> snapshot) {
        // Nothing outlives the process.
    }
}
