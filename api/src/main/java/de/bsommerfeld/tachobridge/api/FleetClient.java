package de.bsommerfeld.tachobridge.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.core.config.FleetConfig;
import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import jakarta.inject.Inject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Raw request helpers for the Fleet service. Every resource is scoped to the
 * company the Fleet token was minted for:
 *
 * <pre>
 * /v1/companies/{companyId}/tachograph-company-card-clients[/{deviceId}]
 * /v1/companies/{companyId}/tachograph-company-cards[/{cardId}]
 * </pre>
 */
@Singleton
public class FleetClient {

    private final JsonHttpClient http;
    private final FleetConfig config;

    @Inject
    public FleetClient(JsonHttpClient http, GlobalConfig config) {
        this.http = http;
        this.config = config.getFleet();
    }

    public JsonNode send(String method, String path, String fleetToken, JsonNode body) throws IOException {
        return http.send(method, JsonHttpClient.resolve(config.getBaseUrl(), path), fleetToken, body,
                Duration.ofSeconds(config.getRequestTimeoutSeconds()));
    }

    public ObjectNode newObject() {
        return http.mapper().createObjectNode();
    }

    public static String bridgeClientsPath(String companyId) {
        return companyPath(companyId) + "/tachograph-company-card-clients";
    }

    public static String bridgeClientPath(String companyId, String deviceId) {
        return bridgeClientsPath(companyId) + "/" + encode(deviceId);
    }

    public static String cardsPath(String companyId) {
        return companyPath(companyId) + "/tachograph-company-cards";
    }

    public static String cardPath(String companyId, String cardId) {
        return cardsPath(companyId) + "/" + encode(cardId);
    }

    private static String companyPath(String companyId) {
        return "/v1/companies/" + encode(companyId);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
