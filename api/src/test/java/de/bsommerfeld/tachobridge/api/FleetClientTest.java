package de.bsommerfeld.tachobridge.api;

import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class FleetClientTest {

    @Test
    void paths_shouldBeCompanyScoped() {
        assertEquals("/v1/companies/42/tachograph-company-card-clients", FleetClient.bridgeClientsPath("42"));
        assertEquals("/v1/companies/42/tachograph-company-card-clients/dev-1",
                FleetClient.bridgeClientPath("42", "dev-1"));
        assertEquals("/v1/companies/42/tachograph-company-cards", FleetClient.cardsPath("42"));
        assertEquals("/v1/companies/42/tachograph-company-cards/7", FleetClient.cardPath("42", "7"));
    }

    @Test
    void paths_shouldEncodeSegments() {
        assertEquals("/v1/companies/a%2Fb/tachograph-company-cards/x%20y", FleetClient.cardPath("a/b", "x y"));
    }

    @Test
    void send_shouldTargetFleetBaseUrl() throws IOException {
        try (LoopbackServer server = LoopbackServer.start()) {
            server.respond("GET", "/v1/companies/42/tachograph-company-cards", 200, "[]");
            GlobalConfig config = new GlobalConfig();
            config.getFleet().setBaseUrl(server.baseUrl());
            FleetClient fleet = new FleetClient(LoopbackServer.client(), config);

            assertTrue(fleet.send("GET", FleetClient.cardsPath("42"), "fleet", null).isArray());
            assertEquals("Bearer fleet", server.last().authorization());
        }
    }
}
