package de.bsommerfeld.tachobridge.core.domain;

/**
 * Persisted keys of the {@link CredentialSet}. The storage names are part of
 * the on-disk format and must not change between releases.
 */
public enum CredentialKey {

    DEVICE_TOKEN("device_token"),
    SESSION_TOKEN("session_token"),
    FLEET_TOKEN("fleet_token"),
    FLEET_COMPANY_ID("fleet_company_id"),
    BRIDGE_CLIENT_IDENTIFIER("bridge_client_identifier"),
    BRIDGE_DEVICE_ID("bridge_device_id"),
    PENDING_AUTHORIZATION_TOKEN("pending_authorization_token");

    private final String storageKey;

    CredentialKey(String storageKey) {
        this.storageKey = storageKey;
    }

    public String storageKey() {
        return storageKey;
    }

    /** Returns the key for a storage name, or {@code null} for unknown names. */
    public static CredentialKey fromStorageKey(String storageKey) {
        for (CredentialKey key : values()) {
            if (key.storageKey.equals(storageKey)) {
                return key;
            }
        }
        return null;
    }
}
