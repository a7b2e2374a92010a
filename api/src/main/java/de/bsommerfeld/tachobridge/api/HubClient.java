package de.bsommerfeld.tachobridge.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import de.bsommerfeld.tachobridge.core.config.HubConfig;
import jakarta.inject.Inject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Raw request helpers for the Hub, the identity service.
 *
 * <h3>Endpoints</h3>
 * <pre>
 * POST /auth/device/authentication-token         → {token, url}
 * GET  /auth/device/authentication-token/check   → 404 pending | 200 {success}
 * POST /auth/device                               → {token}   (device token)
 * POST /auth/session      Bearer device token     → {token}   (session token)
 * any  /rest/..., /actions/...  Bearer session    → JSON
 * </pre>
 *
 * Nothing here retries or checks response fields; that belongs to the token
 * chain and the authorization flow.
 */
@Singleton
public class HubClient {

    static final String AUTHENTICATION_TOKEN_PATH = "/auth/device/authentication-token";
    static final String AUTHENTICATION_CHECK_PATH = "/auth/device/authentication-token/check";
    static final String DEVICE_PATH = "/auth/device";
    static final String SESSION_PATH = "/auth/session";

    private final JsonHttpClient http;
    private final HubConfig config;

    @Inject
    public HubClient(JsonHttpClient http, GlobalConfig config) {
        this.http = http;
        this.config = config.getHub();
    }

    /** Starts a device authorization; the answer carries the token and the approval URL. */
    public JsonNode requestAuthenticationToken() throws IOException {
        ObjectNode body = http.mapper().createObjectNode();
        body.put("mode", "web");
        if (config.getApplicationKey() != null && !config.getApplicationKey().isBlank()) {
            body.put("application_key", config.getApplicationKey());
        }
        return send("POST", AUTHENTICATION_TOKEN_PATH, null, body);
    }

    /**
     * Asks whether the user approved {@code token}. A pending token answers
     * 404, which surfaces as {@link ApiStatusException}.
     */
    public JsonNode checkAuthenticationToken(String token) throws IOException {
        String path = AUTHENTICATION_CHECK_PATH + "?token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
        return send("GET", path, null, null);
    }

    /** Exchanges an approved authorization token for a device token. */
    public JsonNode registerDevice(String approvedToken, DeviceDetails details) throws IOException {
        ObjectNode body = http.mapper().createObjectNode();
        body.put("token", approvedToken);
        details.writeTo(body);
        return send("POST", DEVICE_PATH, null, body);
    }

    /** Exchanges the device token for a fresh session token. */
    public JsonNode createSession(String deviceToken) throws IOException {
        return send("POST", SESSION_PATH, deviceToken, null);
    }

    /**
     * Generic authenticated call.
     *
     * @param pathAndQuery path below the base URL, query string included
     * @param bearerToken  session token, or {@code null} for anonymous calls
     */
    public JsonNode send(String method, String pathAndQuery, String bearerToken, JsonNode body) throws IOException {
        return http.send(method, JsonHttpClient.resolve(config.getBaseUrl(), pathAndQuery), bearerToken, body,
                Duration.ofSeconds(config.getRequestTimeoutSeconds()));
    }
}
