package de.bsommerfeld.tachobridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings for the Fleet service. Its bearer token is never
 * configured here; it is derived from the Hub session at runtime.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FleetConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://api.trackmijn.nl";

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 30;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }
}
