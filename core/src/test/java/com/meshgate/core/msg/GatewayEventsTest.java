package com.meshgate.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshgate.core.model.EndpointStatus;
import com.meshgate.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GatewayEventsTest {

    @Test
    void testBroadcastJsonCarriesTypeDiscriminator() throws Exception {
        GatewayEvent event = new GatewayEvents.CircuitOpened("payments", 60.0, 1_700_000_000_000L);

        JsonNode json = JsonUtils.mapper().readTree(JsonUtils.writeValueAsString(event));

        assertEquals("circuit-opened", json.get("type").asText());
        assertEquals("payments", json.get("serviceName").asText());
        assertEquals(60.0, json.get("errorPercentage").asDouble());
    }

    @Test
    void testEndpointMarkedHealthFollowsStatus() {
        GatewayEvents.EndpointMarked down = new GatewayEvents.EndpointMarked(
            "payments", "http://p1", EndpointStatus.HEALTHY, EndpointStatus.UNHEALTHY, 1L);
        GatewayEvents.EndpointMarked up = new GatewayEvents.EndpointMarked(
            "payments", "http://p1", EndpointStatus.UNHEALTHY, EndpointStatus.HEALTHY, 2L);

        assertFalse(down.isHealthy());
        assertTrue(up.isHealthy());
    }
}
