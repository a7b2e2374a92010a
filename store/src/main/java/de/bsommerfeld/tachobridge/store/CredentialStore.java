package de.bsommerfeld.tachobridge.store;

import de.bsommerfeld.tachobridge.core.domain.CredentialKey;
import de.bsommerfeld.tachobridge.core.domain.CredentialSet;

/**
 * Persistence contract for the {@link CredentialSet}. The store is dumb
 * storage: it never checks whether a token is still valid.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link FileCredentialStore}: JSON file in the platform data
 * directory</li>
 * <li>{@link InMemoryCredentialStore}: TEST mode, nothing touches disk</li>
 * </ul>
 *
 * <p>
 * Every implementation guarantees that {@link #load()} always carries a
 * valid bridge client identifier, generated and persisted on first use.
 */
public interface CredentialStore {

    /** Returns the last persisted set. Absent values are {@code null}. */
    CredentialSet load();

    /**
     * Persists every non-empty value of {@code credentials}. Values absent
     * from the argument are left as they are, so saving a set that only
     * carries a session token does not erase a stored fleet token.
     */
    void save(CredentialSet credentials);

    /**
     * Drops the given keys. The bridge client identifier is never removed;
     * passing its key is ignored.
     */
    void remove(CredentialKey... keys);

    /**
     * Removes every value except the bridge client identifier, which belongs
     * to the physical device rather than to the signed-in user.
     */
    void clear();
}
