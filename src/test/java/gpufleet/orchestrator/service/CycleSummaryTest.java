package gpufleet.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import gpufleet.orchestrator.server.RouterHandler;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CycleSummaryTest {

    private static CycleSummary summary(String error) {
        return new CycleSummary(
                Instant.parse("2026-01-01T12:00:00Z"),
                7,
                120,
                new CycleSummary.Actions(1, 0, 2, 0, 0, 0, 0, 0),
                new CycleSummary.Status(4, 1, 2, 1, 0, 1, 3, 3, 0, 0),
                null,
                false,
                error);
    }

    @Test
    void successfulCycleOmitsError() throws Exception {
        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(summary(null)));

        assertFalse(json.has("error"));
        assertFalse(json.has("breaker"));
        assertFalse(json.has("success"));
        assertEquals("2026-01-01T12:00:00Z", json.get("timestamp").asText());
        assertEquals(7, json.get("cycle").asInt());
        assertEquals(2, json.get("actions").get("workersSpawned").asInt());
        assertEquals(3, json.get("status").get("desired").asInt());
    }

    @Test
    void failedCycleCarriesError() throws Exception {
        CycleSummary failed = summary("database unavailable");
        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(failed));

        assertFalse(failed.isSuccess());
        assertEquals("database unavailable", json.get("error").asText());
    }
}
