package de.bsommerfeld.tachobridge.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class HubClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private LoopbackServer server;
    private GlobalConfig config;
    private HubClient hub;

    @BeforeEach
    void setUp() throws IOException {
        server = LoopbackServer.start();
        config = new GlobalConfig();
        config.getHub().setBaseUrl(server.baseUrl());
        hub = new HubClient(LoopbackServer.client(), config);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void requestAuthenticationToken_shouldRequestWebMode() throws IOException {
        server.respond("POST", HubClient.AUTHENTICATION_TOKEN_PATH, 200, "{\"token\":\"t\",\"url\":\"https://x\"}");

        JsonNode response = hub.requestAuthenticationToken();

        assertEquals("t", response.path("token").asText());
        JsonNode sent = mapper.readTree(server.last().body());
        assertEquals("web", sent.path("mode").asText());
        assertFalse(sent.has("application_key"));
        assertNull(server.last().authorization());
    }

    @Test
    void requestAuthenticationToken_shouldSendConfiguredApplicationKey() throws IOException {
        config.getHub().setApplicationKey("app-key");
        server.respond("POST", HubClient.AUTHENTICATION_TOKEN_PATH, 200, "{}");

        hub.requestAuthenticationToken();

        assertEquals("app-key", mapper.readTree(server.last().body()).path("application_key").asText());
    }

    @Test
    void checkAuthenticationToken_shouldEncodeTokenAsQuery() throws IOException {
        server.respond("GET", HubClient.AUTHENTICATION_CHECK_PATH, 200, "{\"success\":true}");

        JsonNode response = hub.checkAuthenticationToken("a b+c");

        assertTrue(response.path("success").asBoolean());
        assertEquals("token=a+b%2Bc", server.last().rawQuery());
    }

    @Test
    void checkAuthenticationToken_shouldRaiseNotFoundWhilePending() {
        ApiStatusException e = assertThrows(ApiStatusException.class, () -> hub.checkAuthenticationToken("t"));

        assertTrue(e.isNotFound());
    }

    @Test
    void registerDevice_shouldSendTokenAndDeviceDetails() throws IOException {
        server.respond("POST", HubClient.DEVICE_PATH, 200, "{\"token\":\"device\"}");
        DeviceDetails details = new DeviceDetails("host", "Linux", "amd64", "6.1", "1.0.0", "Tacho Bridge");

        hub.registerDevice("approved", details);

        JsonNode sent = mapper.readTree(server.last().body());
        assertEquals("approved", sent.path("token").asText());
        assertEquals("host", sent.path("device_name").asText());
        assertEquals("Linux", sent.path("device_platform").asText());
        assertEquals("amd64", sent.path("device_model").asText());
        assertEquals("6.1", sent.path("os_version").asText());
        assertEquals("1.0.0", sent.path("application_version").asText());
        assertEquals("Tacho Bridge", sent.path("device_manufacturer").asText());
    }

    @Test
    void createSession_shouldAuthenticateWithDeviceToken() throws IOException {
        server.respond("POST", HubClient.SESSION_PATH, 200, "{\"token\":\"session\"}");

        JsonNode response = hub.createSession("device");

        assertEquals("session", response.path("token").asText());
        assertEquals("Bearer device", server.last().authorization());
    }

    @Test
    void send_shouldSurfaceUpgradeRequired() {
        server.respond("GET", "/rest/me", 426, "{}");

        ApiStatusException e = assertThrows(ApiStatusException.class,
                () -> hub.send("GET", "/rest/me?relations[]=current_role", "session", null));

        assertTrue(e.isUpgradeRequired());
    }

    @Test
    void deviceDetails_shouldDescribeThisMachine() {
        DeviceDetails details = DeviceDetails.current();

        assertNotNull(details.deviceName());
        assertEquals(System.getProperty("os.name"), details.devicePlatform());
        assertEquals(DeviceDetails.MANUFACTURER, details.deviceManufacturer());
        assertEquals(ApplicationVersion.get(), details.applicationVersion());
    }
}
