package de.bsommerfeld.tachobridge.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.api.FleetClient;
import de.bsommerfeld.tachobridge.api.JsonFields;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps this device registered as a bridge client in the Fleet service.
 *
 * <p>
 * The registration is addressed by a server-assigned device id that cannot
 * be derived from the stable client identifier, and creating it may conflict
 * with a registration left by an earlier run on the same machine. Each
 * attempt therefore verifies the cached id, creates when it is missing and
 * verifies the result. A 409 without a device id falls back to the last id
 * this device knew about. Two attempts at most; then the caller is told.
 */
@Singleton
public class BridgeClientRegistrar {

    private static final Logger LOG = LoggerFactory.getLogger(BridgeClientRegistrar.class);

    static final int MAX_ATTEMPTS = 2;

    private final TokenChainManager tokenChain;
    private final FleetClient fleet;

    @Inject
    public BridgeClientRegistrar(TokenChainManager tokenChain, FleetClient fleet) {
        this.tokenChain = tokenChain;
        this.fleet = fleet;
    }

    /**
     * Makes sure a verified registration exists.
     *
     * @return the verified device id, also persisted
     * @throws VerificationException            if a verification answers anything but 200 or 404
     * @throws BridgeClientResolutionException  if no verified id emerged within the attempt budget
     */
    public String ensureRegistered() throws ConnectionException {
        String identifier = tokenChain.credentials().bridgeClientIdentifier();
        if (identifier == null) {
            throw new BridgeClientResolutionException(MessageKeys.ERROR_BRIDGE_RESOLVE,
                    "No bridge client identifier available");
        }

        String lastKnown = tokenChain.credentials().bridgeDeviceId();
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String cached = tokenChain.credentials().bridgeDeviceId();
            if (cached != null) {
                lastKnown = cached;
                if (exists(cached)) {
                    LOG.debug("Bridge client {} verified", cached);
                    return cached;
                }
                LOG.info("Cached bridge client {} no longer exists", cached);
                tokenChain.forgetBridgeDeviceId();
            }

            String created = create(identifier, lastKnown);
            if (exists(created)) {
                tokenChain.rememberBridgeDeviceId(created);
                LOG.info("Bridge client {} registered for {}", created, identifier);
                return created;
            }
            LOG.warn("Bridge client {} could not be verified after creation (attempt {}/{})",
                    created, attempt, MAX_ATTEMPTS);
            tokenChain.forgetBridgeDeviceId();
        }

        throw new BridgeClientResolutionException(MessageKeys.ERROR_BRIDGE_RESOLVE,
                "No verified bridge client after " + MAX_ATTEMPTS + " attempts");
    }

    /**
     * Removes this device's registration. A registration that is already
     * gone counts as removed.
     *
     * @return {@code false} if there was no registration to remove
     */
    public boolean unregister() throws ConnectionException {
        String deviceId = tokenChain.credentials().bridgeDeviceId();
        if (deviceId == null) {
            return false;
        }
        try {
            tokenChain.callFleet("DELETE", companyId -> FleetClient.bridgeClientPath(companyId, deviceId), null);
            LOG.info("Bridge client {} removed", deviceId);
        } catch (FleetRequestException e) {
            if (!e.isNotFound()) {
                throw new BridgeClientResolutionException(MessageKeys.ERROR_BRIDGE_REMOVE,
                        "Removing bridge client " + deviceId + " failed", e);
            }
            LOG.debug("Bridge client {} was already gone", deviceId);
        }
        tokenChain.forgetBridgeDeviceId();
        return true;
    }

    boolean exists(String deviceId) throws ConnectionException {
        try {
            tokenChain.callFleet("GET", companyId -> FleetClient.bridgeClientPath(companyId, deviceId), null);
            return true;
        } catch (FleetRequestException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw new VerificationException(MessageKeys.ERROR_BRIDGE_VERIFY,
                    "Verifying bridge client " + deviceId + " failed", e.statusCode(), e);
        }
    }

    private String create(String identifier, String fallbackDeviceId) throws ConnectionException {
        ObjectNode body = fleet.newObject();
        body.put("client_identifier", identifier);

        JsonNode response;
        boolean conflict = false;
        try {
            response = tokenChain.callFleet("POST", FleetClient::bridgeClientsPath, body);
        } catch (FleetRequestException e) {
            if (!e.isConflict()) {
                throw new BridgeClientResolutionException(MessageKeys.ERROR_BRIDGE_CREATE,
                        "Creating bridge client failed", e);
            }
            response = e.body();
            conflict = true;
        }

        String deviceId = JsonFields.text(JsonFields.unwrap(response), "device_id");
        if (deviceId != null) {
            return deviceId;
        }
        if (conflict && fallbackDeviceId != null) {
            LOG.info("Bridge client already exists, re-checking known id {}", fallbackDeviceId);
            return fallbackDeviceId;
        }
        throw new BridgeClientResolutionException(MessageKeys.ERROR_BRIDGE_RESOLVE,
                conflict ? "Bridge client exists but its device id is unknown"
                        : "Bridge client creation returned no device id");
    }
}
