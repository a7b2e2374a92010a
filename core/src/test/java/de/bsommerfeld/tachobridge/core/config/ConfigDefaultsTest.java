package de.bsommerfeld.tachobridge.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void globalConfig_shouldInitializeWithDefaults() {
        var config = new GlobalConfig();

        assertFalse(config.isDebugMode());
        assertNotNull(config.getHub());
        assertNotNull(config.getFleet());
        assertNotNull(config.getAuthorization());
        assertNotNull(config.getUser());
    }

    @Test
    void hubConfig_shouldPointAtProduction() {
        var config = new HubConfig();

        assertEquals("https://api.transportklok.nl", config.getBaseUrl());
        assertEquals("", config.getApplicationKey());
        assertEquals(30, config.getRequestTimeoutSeconds());
    }

    @Test
    void fleetConfig_shouldPointAtProduction() {
        var config = new FleetConfig();

        assertEquals("https://api.trackmijn.nl", config.getBaseUrl());
        assertEquals(30, config.getRequestTimeoutSeconds());
    }

    @Test
    void authorizationConfig_shouldPollEveryFiveSecondsForFiveMinutes() {
        var config = new AuthorizationConfig();

        assertEquals(5, config.getPollIntervalSeconds());
        assertEquals(5, config.getPollTimeoutMinutes());
        assertEquals("tachobridge://open", config.getRedirectUri());
    }

    @Test
    void userConfig_shouldDefaultToDutch() {
        assertEquals("nl", new UserConfig().getLanguage());
    }
}
