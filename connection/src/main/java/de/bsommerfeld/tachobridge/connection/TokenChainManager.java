package de.bsommerfeld.tachobridge.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.api.ApiStatusException;
import de.bsommerfeld.tachobridge.api.DeviceDetails;
import de.bsommerfeld.tachobridge.api.FleetClient;
import de.bsommerfeld.tachobridge.api.HubClient;
import de.bsommerfeld.tachobridge.api.JsonFields;
import de.bsommerfeld.tachobridge.core.domain.CredentialKey;
import de.bsommerfeld.tachobridge.core.domain.CredentialSet;
import de.bsommerfeld.tachobridge.core.domain.UserIdentity;
import de.bsommerfeld.tachobridge.store.CredentialStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Function;

/**
 * Owns the credential chain {@code device → session → fleet token} and makes
 * sure every authenticated request carries a usable bearer token.
 *
 * <h3>Derivation</h3>
 * <pre>
 * approved auth token ──registerDevice──▶ device token
 * device token ─────────createSession───▶ session token     (Hub)
 * session token ────────POST fleet/tokens▶ fleet token + company id
 * </pre>
 * Fleet tokens are minted by the Hub on behalf of the signed-in user, never
 * by Fleet itself. Tokens are derived lazily on first use and every result
 * is persisted before it is used, so a crash mid-chain never forces the
 * user to re-derive upstream tokens that are still valid.
 *
 * <h3>Unauthorized responses</h3>
 * A token can expire between the moment it is read and the moment the
 * backend checks it. A 401 therefore triggers exactly one refresh of the
 * rejected token and one retry of the original call. A second 401 is final.
 * The retry is a bounded loop; the refresh always completes and persists
 * before the retried request is sent.
 */
@Singleton
public class TokenChainManager {

    private static final Logger LOG = LoggerFactory.getLogger(TokenChainManager.class);

    static final String CURRENT_USER_PATH =
            "/rest/me?relations[]=currentOrganization.name&relations[]=current_role";
    static final String FLEET_TOKENS_PATH = "/actions/management/fleet/tokens";

    /** One original attempt plus one retry after a token refresh. */
    static final int MAX_ATTEMPTS = 2;

    private final HubClient hub;
    private final FleetClient fleet;
    private final CredentialStore store;

    @Inject
    public TokenChainManager(HubClient hub, FleetClient fleet, CredentialStore store) {
        this.hub = hub;
        this.fleet = fleet;
        this.store = store;
    }

    /** Current snapshot of the persisted credentials. */
    public CredentialSet credentials() {
        return store.load();
    }

    // =====================================================================
    // Hub chain
    // =====================================================================

    /**
     * Exchanges an approved authorization token for a device token. Any
     * session or fleet token derived from a previous device is dropped.
     */
    public String registerDevice(String approvedToken) throws ConnectionException {
        JsonNode response;
        try {
            response = hub.registerDevice(approvedToken, DeviceDetails.current());
        } catch (IOException e) {
            throw hubFailure(MessageKeys.ERROR_DEVICE_REGISTRATION, "Device registration failed", e);
        }

        String deviceToken = JsonFields.text(response, "token");
        if (deviceToken == null) {
            throw new HubRequestException(MessageKeys.ERROR_DEVICE_REGISTRATION,
                    "Device token missing from registration response", -1);
        }
        store.remove(CredentialKey.SESSION_TOKEN, CredentialKey.FLEET_TOKEN, CredentialKey.FLEET_COMPANY_ID);
        store.save(CredentialSet.of(CredentialKey.DEVICE_TOKEN, deviceToken));
        LOG.info("Device registered at the Hub");
        return deviceToken;
    }

    /** Derives a fresh session token from the stored device token. */
    public String createSession() throws ConnectionException {
        String deviceToken = store.load().deviceToken();
        if (deviceToken == null) {
            throw new NotAuthenticatedException("No device token to derive a session from");
        }

        JsonNode response;
        try {
            response = hub.createSession(deviceToken);
        } catch (IOException e) {
            throw hubFailure(MessageKeys.ERROR_SESSION, "Session creation failed", e);
        }

        String sessionToken = JsonFields.text(response, "token");
        if (sessionToken == null) {
            throw new HubRequestException(MessageKeys.ERROR_SESSION, "Session token missing from response", -1);
        }
        store.save(CredentialSet.of(CredentialKey.SESSION_TOKEN, sessionToken));
        LOG.debug("Session derived from device token");
        return sessionToken;
    }

    /**
     * Sends an authenticated Hub request. Derives a session first when only
     * a device token exists; on 401 derives one fresh session and retries
     * once.
     *
     * @return parsed response body
     * @throws HubRequestException        on any failure after the retry budget
     * @throws NotAuthenticatedException  when neither device nor session token exists
     */
    public JsonNode callHub(String method, String pathAndQuery, JsonNode body) throws ConnectionException {
        for (int attempt = 1;; attempt++) {
            CredentialSet current = store.load();
            String sessionToken = current.sessionToken();
            if (sessionToken == null && current.hasDeviceToken()) {
                sessionToken = createSession();
            }
            if (sessionToken == null) {
                throw new NotAuthenticatedException("Not authenticated at the Hub");
            }

            try {
                return hub.send(method, pathAndQuery, sessionToken, body);
            } catch (ApiStatusException e) {
                checkOutdated(e);
                if (e.isUnauthorized() && attempt < MAX_ATTEMPTS && store.load().hasDeviceToken()) {
                    LOG.info("Hub rejected the session on {} {}, deriving a fresh one", method, stripQuery(pathAndQuery));
                    createSession();
                    continue;
                }
                throw new HubRequestException(MessageKeys.ERROR_HUB_REQUEST,
                        "Hub request " + method + " " + stripQuery(pathAndQuery) + " failed with HTTP "
                                + e.statusCode(),
                        e.statusCode(), e);
            } catch (IOException e) {
                throw new HubRequestException(MessageKeys.ERROR_NETWORK,
                        "Hub request " + method + " " + stripQuery(pathAndQuery) + " failed", -1, e);
            }
        }
    }

    /** Fetches the signed-in user. */
    public UserIdentity fetchCurrentUser() throws ConnectionException {
        JsonNode user = JsonFields.unwrap(callHub("GET", CURRENT_USER_PATH, null));
        if (user == null || !user.isObject()) {
            throw new HubRequestException(MessageKeys.ERROR_HUB_RESPONSE, "User profile response is not an object", -1);
        }

        JsonNode organization = user.has("currentOrganization") ? user.path("currentOrganization")
                : user.path("current_organization");
        return new UserIdentity(
                JsonFields.text(user, "id"),
                JsonFields.text(user, "email"),
                JsonFields.text(user, "first_name"),
                JsonFields.text(user, "last_name"),
                roleOf(user.path("current_role")),
                JsonFields.text(organization, "name"));
    }

    /**
     * Validates the stored session by fetching the user and applying the role
     * gate. A rejected user has every credential cleared before this returns.
     */
    public LoginOutcome ensureSession() throws ConnectionException {
        UserIdentity user = fetchCurrentUser();
        LoginOutcome outcome = LoginOutcome.evaluate(user);
        if (outcome instanceof LoginOutcome.Rejected) {
            LOG.warn("User {} has role '{}', clearing credentials", user.id(), user.currentRole());
            clearCredentials();
        }
        return outcome;
    }

    // =====================================================================
    // Fleet chain
    // =====================================================================

    /**
     * Returns the Fleet token and company id, deriving them through the Hub
     * when absent or when {@code forceRefresh} is set.
     */
    public FleetCredentials fleetCredentials(boolean forceRefresh) throws ConnectionException {
        CredentialSet current = store.load();
        if (!forceRefresh && current.hasFleetCredentials()) {
            return new FleetCredentials(current.fleetToken(), current.fleetCompanyId());
        }

        JsonNode payload = JsonFields.unwrap(callHub("POST", FLEET_TOKENS_PATH, null));
        String token = JsonFields.text(payload, "token");
        String companyId = JsonFields.text(payload, "company_id");
        if (token == null || companyId == null) {
            throw new FleetRequestException(MessageKeys.ERROR_FLEET_TOKEN,
                    "Fleet token response lacks token or company id", -1, payload, null);
        }

        store.save(new CredentialSet(null, null, token, companyId, null, null, null));
        LOG.info("Fleet token {} for company {}", forceRefresh ? "refreshed" : "derived", companyId);
        return new FleetCredentials(token, companyId);
    }

    /**
     * Sends a Fleet request. The path is built from the company id so a
     * refresh that changes the company is honoured on retry. On 401 the
     * Fleet token is refreshed (bypassing the cached one) and the call is
     * retried once.
     *
     * @param pathForCompany maps the company id to the request path
     * @throws FleetRequestException for any non-success after the retry
     *                               budget, carrying status and body
     */
    public JsonNode callFleet(String method, Function<String, String> pathForCompany, JsonNode body)
            throws ConnectionException {
        FleetCredentials credentials = fleetCredentials(false);
        for (int attempt = 1;; attempt++) {
            String path = pathForCompany.apply(credentials.companyId());
            try {
                return fleet.send(method, path, credentials.token(), body);
            } catch (ApiStatusException e) {
                checkOutdated(e);
                if (e.isUnauthorized() && attempt < MAX_ATTEMPTS) {
                    LOG.info("Fleet rejected the token on {} {}, refreshing", method, path);
                    credentials = fleetCredentials(true);
                    continue;
                }
                throw new FleetRequestException(MessageKeys.ERROR_FLEET_REQUEST,
                        "Fleet request " + method + " " + path + " failed with HTTP " + e.statusCode(),
                        e.statusCode(), e.body(), e);
            } catch (IOException e) {
                throw new FleetRequestException(MessageKeys.ERROR_NETWORK,
                        "Fleet request " + method + " " + path + " failed", -1, null, e);
            }
        }
    }

    // =====================================================================
    // Credential bookkeeping
    // =====================================================================

    public void rememberPendingAuthorization(String token) {
        store.save(CredentialSet.of(CredentialKey.PENDING_AUTHORIZATION_TOKEN, token));
    }

    public void forgetPendingAuthorization() {
        store.remove(CredentialKey.PENDING_AUTHORIZATION_TOKEN);
    }

    public void rememberBridgeDeviceId(String deviceId) {
        store.save(CredentialSet.of(CredentialKey.BRIDGE_DEVICE_ID, deviceId));
    }

    public void forgetBridgeDeviceId() {
        store.remove(CredentialKey.BRIDGE_DEVICE_ID);
    }

    /** Signs out. The bridge client identifier survives. */
    public void clearCredentials() {
        store.clear();
    }

    private HubRequestException hubFailure(String messageKey, String message, IOException cause)
            throws ApplicationOutdatedException {
        if (cause instanceof ApiStatusException status) {
            checkOutdated(status);
            return new HubRequestException(messageKey, message + " with HTTP " + status.statusCode(),
                    status.statusCode(), cause);
        }
        return new HubRequestException(MessageKeys.ERROR_NETWORK, message, -1, cause);
    }

    static void checkOutdated(ApiStatusException e) throws ApplicationOutdatedException {
        if (e.isUpgradeRequired()) {
            throw new ApplicationOutdatedException("Backend requires a newer application version", e);
        }
    }

    private static String roleOf(JsonNode role) {
        if (role.isObject()) {
            String name = JsonFields.text(role, "name");
            return name != null ? name : JsonFields.text(role, "slug");
        }
        return role.isValueNode() && !role.isNull() ? role.asText() : null;
    }

    private static String stripQuery(String pathAndQuery) {
        int query = pathAndQuery.indexOf('?');
        return query < 0 ? pathAndQuery : pathAndQuery.substring(0, query);
    }
}
