package de.bsommerfeld.tachobridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each backend and the login handshake get their
 * own table so the file stays readable when edited by hand.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("hub")
    private HubConfig hub = new HubConfig();

    @JsonProperty("fleet")
    private FleetConfig fleet = new FleetConfig();

    @JsonProperty("authorization")
    private AuthorizationConfig authorization = new AuthorizationConfig();

    @JsonProperty("user")
    private UserConfig user = new UserConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public HubConfig getHub() {
        return hub;
    }

    public FleetConfig getFleet() {
        return fleet;
    }

    public AuthorizationConfig getAuthorization() {
        return authorization;
    }

    public UserConfig getUser() {
        return user;
    }
}
