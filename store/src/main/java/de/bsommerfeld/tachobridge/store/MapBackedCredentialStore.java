package de.bsommerfeld.tachobridge.store;

import de.bsommerfeld.tachobridge.core.domain.BridgeIdentifiers;
import de.bsommerfeld.tachobridge.core.domain.CredentialKey;
import de.bsommerfeld.tachobridge.core.domain.CredentialSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Shared merge logic of the credential stores. Keeps the current values in
 * memory and hands a full copy to {@link #persist(Map)} after every change,
 * so subclasses only deal with reading and writing a complete snapshot. A
 * change becomes visible only once it was persisted; a failed write leaves
 * memory at the last persisted state.
 *
 * <p>
 * All public methods are synchronized. Concurrent savers never lose each
 * other's fields; the last write wins per key.
 */
abstract class MapBackedCredentialStore implements CredentialStore {

    private static final Logger LOG = LoggerFactory.getLogger(MapBackedCredentialStore.class);

    private Map<CredentialKey, String> values;

    /** Reads the complete persisted snapshot. Called once, on first access. */
    protected abstract Map<CredentialKey, String> readAll();

    /** Replaces the persisted snapshot with {@code snapshot}. */
    protected abstract void persist(Map<CredentialKey, String> snapshot);

    @Override
    public synchronized CredentialSet load() {
        return CredentialSet.fromValues(values());
    }

    @Override
    public synchronized void save(CredentialSet credentials) {
        Map<CredentialKey, String> incoming = credentials.toValues();
        if (incoming.isEmpty()) {
            return;
        }

        Map<CredentialKey, String> next = new EnumMap<>(values());
        boolean changed = false;
        for (Map.Entry<CredentialKey, String> entry : incoming.entrySet()) {
            String value = entry.getValue();
            if (entry.getKey() == CredentialKey.BRIDGE_CLIENT_IDENTIFIER && !BridgeIdentifiers.isValid(value)) {
                LOG.warn("Ignoring malformed bridge client identifier on save");
                continue;
            }
            changed |= !value.equals(next.put(entry.getKey(), value));
        }
        if (changed) {
            commit(next);
        }
    }

    @Override
    public synchronized void remove(CredentialKey... keys) {
        Map<CredentialKey, String> next = new EnumMap<>(values());
        boolean changed = false;
        for (CredentialKey key : keys) {
            if (key == CredentialKey.BRIDGE_CLIENT_IDENTIFIER) {
                continue;
            }
            changed |= next.remove(key) != null;
        }
        if (changed) {
            commit(next);
        }
    }

    @Override
    public synchronized void clear() {
        String identifier = values().get(CredentialKey.BRIDGE_CLIENT_IDENTIFIER);
        Map<CredentialKey, String> next = new EnumMap<>(CredentialKey.class);
        next.put(CredentialKey.BRIDGE_CLIENT_IDENTIFIER, identifier);
        commit(next);
        LOG.info("Credentials cleared, bridge client identifier {} kept", identifier);
    }

    /** Persists {@code next} and adopts it only if the write succeeded. */
    private void commit(Map<CredentialKey, String> next) {
        persist(new EnumMap<>(next));
        values = next;
    }

    private Map<CredentialKey, String> values() {
        if (values == null) {
            Map<CredentialKey, String> loaded = new EnumMap<>(CredentialKey.class);
            loaded.putAll(readAll());
            if (ensureBridgeIdentifier(loaded)) {
                persist(new EnumMap<>(loaded));
            }
            values = loaded;
        }
        return values;
    }

    private static boolean ensureBridgeIdentifier(Map<CredentialKey, String> loaded) {
        String stored = loaded.get(CredentialKey.BRIDGE_CLIENT_IDENTIFIER);
        String normalized = BridgeIdentifiers.normalize(stored);
        if (normalized.equals(stored)) {
            return false;
        }
        if (stored == null) {
            LOG.info("Generated bridge client identifier {}", normalized);
        } else {
            LOG.warn("Normalized stored bridge client identifier '{}' to {}", stored, normalized);
        }
        loaded.put(CredentialKey.BRIDGE_CLIENT_IDENTIFIER, normalized);
        return true;
    }
}
