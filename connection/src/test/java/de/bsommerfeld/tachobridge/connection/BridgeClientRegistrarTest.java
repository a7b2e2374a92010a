package de.bsommerfeld.tachobridge.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.tachobridge.api.FleetClient;
import de.bsommerfeld.tachobridge.api.HubClient;
import de.bsommerfeld.tachobridge.core.domain.CredentialKey;
import de.bsommerfeld.tachobridge.core.domain.CredentialSet;
import de.bsommerfeld.tachobridge.store.CredentialStore;
import de.bsommerfeld.tachobridge.store.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static de.bsommerfeld.tachobridge.connection.Json.parse;
import static de.bsommerfeld.tachobridge.connection.Json.status;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BridgeClientRegistrarTest {

    private static final String IDENTIFIER = "TBA1234567890123";
    private static final String CLIENTS = FleetClient.bridgeClientsPath("42");

    private FleetClient fleet;
    private CredentialStore store;
    private BridgeClientRegistrar registrar;

    @BeforeEach
    void setUp() {
        fleet = mock(FleetClient.class);
        when(fleet.newObject()).thenAnswer(invocation -> Json.MAPPER.createObjectNode());
        store = new InMemoryCredentialStore(Map.of(
                CredentialKey.BRIDGE_CLIENT_IDENTIFIER, IDENTIFIER,
                CredentialKey.FLEET_TOKEN, "fleet",
                CredentialKey.FLEET_COMPANY_ID, "42"));
        TokenChainManager tokenChain = new TokenChainManager(mock(HubClient.class), fleet, store);
        registrar = new BridgeClientRegistrar(tokenChain, fleet);
    }

    private static String client(String deviceId) {
        return FleetClient.bridgeClientPath("42", deviceId);
    }

    @Test
    void ensureRegistered_shouldKeepVerifiedCachedId() throws Exception {
        store.save(CredentialSet.of(CredentialKey.BRIDGE_DEVICE_ID, "dev-1"));
        when(fleet.send("GET", client("dev-1"), "fleet", null)).thenReturn(parse("{\"device_id\":\"dev-1\"}"));

        assertEquals("dev-1", registrar.ensureRegistered());
        verify(fleet, never()).send(eq("POST"), anyString(), anyString(), any());
    }

    @Test
    void ensureRegistered_shouldCreateWhenNothingIsCached() throws Exception {
        when(fleet.send(eq("POST"), eq(CLIENTS), eq("fleet"), any())).thenReturn(parse("{\"data\":{\"device_id\":\"dev-2\"}}"));
        when(fleet.send("GET", client("dev-2"), "fleet", null)).thenReturn(parse("{}"));

        assertEquals("dev-2", registrar.ensureRegistered());

        assertEquals("dev-2", store.load().bridgeDeviceId());
        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(fleet).send(eq("POST"), eq(CLIENTS), eq("fleet"), body.capture());
        assertEquals(IDENTIFIER, body.getValue().path("client_identifier").asText());
    }

    @Test
    void ensureRegistered_shouldRecheckKnownIdAfterConflictWithoutId() throws Exception {
        store.save(CredentialSet.of(CredentialKey.BRIDGE_DEVICE_ID, "dev-1"));
        when(fleet.send("GET", client("dev-1"), "fleet", null))
                .thenThrow(status(404))
                .thenReturn(parse("{}"));
        when(fleet.send(eq("POST"), eq(CLIENTS), eq("fleet"), any())).thenThrow(status(409, "{\"message\":\"exists\"}"));

        assertEquals("dev-1", registrar.ensureRegistered());

        assertEquals("dev-1", store.load().bridgeDeviceId());
        verify(fleet, times(1)).send(eq("POST"), eq(CLIENTS), eq("fleet"), any(ObjectNode.class));
    }

    @Test
    void ensureRegistered_shouldTakeDeviceIdFromConflictBody() throws Exception {
        when(fleet.send(eq("POST"), eq(CLIENTS), eq("fleet"), any()))
                .thenThrow(status(409, "{\"device_id\":\"dev-3\"}"));
        when(fleet.send("GET", client("dev-3"), "fleet", null)).thenReturn(parse("{}"));

        assertEquals("dev-3", registrar.ensureRegistered());
    }

    @Test
    void ensureRegistered_shouldFailOnConflictWithoutAnyKnownId() throws Exception {
        when(fleet.send(eq("POST"), eq(CLIENTS), eq("fleet"), any())).thenThrow(status(409));

        BridgeClientResolutionException e = assertThrows(BridgeClientResolutionException.class,
                () -> registrar.ensureRegistered());
        assertEquals(MessageKeys.ERROR_BRIDGE_RESOLVE, e.messageKey());
    }

    @Test
    void ensureRegistered_shouldGiveUpAfterAttemptBudget() throws Exception {
        when(fleet.send(eq("POST"), eq(CLIENTS), eq("fleet"), any()))
                .thenReturn(parse("{\"device_id\":\"a\"}"))
                .thenReturn(parse("{\"device_id\":\"b\"}"));
        when(fleet.send(eq("GET"), anyString(), eq("fleet"), any())).thenThrow(status(404));

        BridgeClientResolutionException e = assertThrows(BridgeClientResolutionException.class,
                () -> registrar.ensureRegistered());

        assertEquals(MessageKeys.ERROR_BRIDGE_RESOLVE, e.messageKey());
        assertNull(store.load().bridgeDeviceId());
        verify(fleet, times(BridgeClientRegistrar.MAX_ATTEMPTS)).send(eq("POST"), eq(CLIENTS), eq("fleet"), any());
    }

    @Test
    void ensureRegistered_shouldReportCreationFailure() throws Exception {
        when(fleet.send(eq("POST"), eq(CLIENTS), eq("fleet"), any())).thenThrow(status(500));

        BridgeClientResolutionException e = assertThrows(BridgeClientResolutionException.class,
                () -> registrar.ensureRegistered());
        assertEquals(MessageKeys.ERROR_BRIDGE_CREATE, e.messageKey());
    }

    @Test
    void ensureRegistered_shouldNotTreatServerErrorAsMissing() throws Exception {
        store.save(CredentialSet.of(CredentialKey.BRIDGE_DEVICE_ID, "dev-1"));
        when(fleet.send("GET", client("dev-1"), "fleet", null)).thenThrow(status(503));

        VerificationException e = assertThrows(VerificationException.class, () -> registrar.ensureRegistered());

        assertEquals(503, e.statusCode());
        assertEquals(MessageKeys.ERROR_BRIDGE_VERIFY, e.messageKey());
        assertEquals("dev-1", store.load().bridgeDeviceId());
    }

    @Test
    void unregister_shouldDeleteAndForgetId() throws Exception {
        store.save(CredentialSet.of(CredentialKey.BRIDGE_DEVICE_ID, "dev-1"));
        when(fleet.send("DELETE", client("dev-1"), "fleet", null)).thenReturn(parse("{}"));

        assertTrue(registrar.unregister());
        assertNull(store.load().bridgeDeviceId());
    }

    @Test
    void unregister_shouldTolerateMissingRegistration() throws Exception {
        store.save(CredentialSet.of(CredentialKey.BRIDGE_DEVICE_ID, "dev-1"));
        when(fleet.send("DELETE", client("dev-1"), "fleet", null)).thenThrow(status(404));

        assertTrue(registrar.unregister());
        assertNull(store.load().bridgeDeviceId());
    }

    @Test
    void unregister_shouldKeepIdWhenRemovalFails() throws Exception {
        store.save(CredentialSet.of(CredentialKey.BRIDGE_DEVICE_ID, "dev-1"));
        when(fleet.send("DELETE", client("dev-1"), "fleet", null)).thenThrow(status(500));

        BridgeClientResolutionException e = assertThrows(BridgeClientResolutionException.class,
                () -> registrar.unregister());

        assertEquals(MessageKeys.ERROR_BRIDGE_REMOVE, e.messageKey());
        assertEquals("dev-1", store.load().bridgeDeviceId());
    }

    @Test
    void unregister_shouldReportNothingToRemove() throws Exception {
        assertFalse(registrar.unregister());
        verify(fleet, never()).send(anyString(), anyString(), anyString(), any());
    }
}
