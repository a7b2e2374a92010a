package de.bsommerfeld.tachobridge.core.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of every token and identifier the bridge persists.
 * Absent values are {@code null}; blank strings are normalized to
 * {@code null} on construction.
 *
 * <p>
 * Invariants maintained by the writers of this set:
 * <ul>
 * <li>a session token was derived from a device token</li>
 * <li>a fleet token is always stored together with its company id</li>
 * <li>the bridge device id refers to a verified remote registration</li>
 * </ul>
 *
 * @param deviceToken               long-lived credential of this device at the Hub
 * @param sessionToken              short-lived Hub session derived from the device token
 * @param fleetToken                Fleet bearer token minted by the Hub
 * @param fleetCompanyId            company scope of the Fleet token
 * @param bridgeClientIdentifier    stable {@code TBA} identifier of this device
 * @param bridgeDeviceId            server-assigned id of the Fleet registration object
 * @param pendingAuthorizationToken device authorization token awaiting user approval
 */
public record CredentialSet(
        String deviceToken,
        String sessionToken,
        String fleetToken,
        String fleetCompanyId,
        String bridgeClientIdentifier,
        String bridgeDeviceId,
        String pendingAuthorizationToken) {

    public CredentialSet {
        deviceToken = blankToNull(deviceToken);
        sessionToken = blankToNull(sessionToken);
        fleetToken = blankToNull(fleetToken);
        fleetCompanyId = blankToNull(fleetCompanyId);
        bridgeClientIdentifier = blankToNull(bridgeClientIdentifier);
        bridgeDeviceId = blankToNull(bridgeDeviceId);
        pendingAuthorizationToken = blankToNull(pendingAuthorizationToken);
    }

    public static CredentialSet empty() {
        return new CredentialSet(null, null, null, null, null, null, null);
    }

    /** A set carrying a single value, for partial saves. */
    public static CredentialSet of(CredentialKey key, String value) {
        Map<CredentialKey, String> values = new EnumMap<>(CredentialKey.class);
        values.put(key, value);
        return fromValues(values);
    }

    public static CredentialSet fromValues(Map<CredentialKey, String> values) {
        return new CredentialSet(
                values.get(CredentialKey.DEVICE_TOKEN),
                values.get(CredentialKey.SESSION_TOKEN),
                values.get(CredentialKey.FLEET_TOKEN),
                values.get(CredentialKey.FLEET_COMPANY_ID),
                values.get(CredentialKey.BRIDGE_CLIENT_IDENTIFIER),
                values.get(CredentialKey.BRIDGE_DEVICE_ID),
                values.get(CredentialKey.PENDING_AUTHORIZATION_TOKEN));
    }

    public String get(CredentialKey key) {
        return switch (key) {
            case DEVICE_TOKEN -> deviceToken;
            case SESSION_TOKEN -> sessionToken;
            case FLEET_TOKEN -> fleetToken;
            case FLEET_COMPANY_ID -> fleetCompanyId;
            case BRIDGE_CLIENT_IDENTIFIER -> bridgeClientIdentifier;
            case BRIDGE_DEVICE_ID -> bridgeDeviceId;
            case PENDING_AUTHORIZATION_TOKEN -> pendingAuthorizationToken;
        };
    }

    /** Present values only, in declaration order of {@link CredentialKey}. */
    public Map<CredentialKey, String> toValues() {
        Map<CredentialKey, String> values = new EnumMap<>(CredentialKey.class);
        for (CredentialKey key : CredentialKey.values()) {
            String value = get(key);
            if (value != null) {
                values.put(key, value);
            }
        }
        return Collections.unmodifiableMap(values);
    }

    public boolean hasDeviceToken() {
        return deviceToken != null;
    }

    public boolean hasSessionToken() {
        return sessionToken != null;
    }

    public boolean hasFleetCredentials() {
        return fleetToken != null && fleetCompanyId != null;
    }

    @Override
    public String toString() {
        // Tokens end up in debug logs through event payloads; never print them.
        return "CredentialSet[present=" + toValues().keySet() + ", bridgeClientIdentifier="
                + bridgeClientIdentifier + "]";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
