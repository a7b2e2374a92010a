package de.bsommerfeld.tachobridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Timing of the browser-based device authorization handshake.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthorizationConfig {

    @JsonProperty("poll-interval-seconds")
    private long pollIntervalSeconds = 5;

    @JsonProperty("poll-timeout-minutes")
    private long pollTimeoutMinutes = 5;

    /** Appended to the approval URL so the browser can hand control back to the app. */
    @JsonProperty("redirect-uri")
    private String redirectUri = "tachobridge://open";

    public long getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public void setPollIntervalSeconds(long pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public long getPollTimeoutMinutes() {
        return pollTimeoutMinutes;
    }

    public void setPollTimeoutMinutes(long pollTimeoutMinutes) {
        this.pollTimeoutMinutes = pollTimeoutMinutes;
    }

    public String getRedirectUri() {
        return redirectUri;
    }
}
