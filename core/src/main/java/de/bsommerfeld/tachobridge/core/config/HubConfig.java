package de.bsommerfeld.tachobridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings for the Hub, the identity service that issues device
 * and session tokens and mints Fleet tokens on behalf of the user.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HubConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://api.transportklok.nl";

    @JsonProperty("application-key")
    private String applicationKey = "";

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 30;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApplicationKey() {
        return applicationKey;
    }

    public void setApplicationKey(String applicationKey) {
        this.applicationKey = applicationKey;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }
}
