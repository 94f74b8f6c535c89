package gpufleet.orchestrator.server;

import com.fasterxml.jackson.databind.JsonNode;
import gpufleet.orchestrator.config.Dependencies;
import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.service.CycleSummary;
import gpufleet.orchestrator.testing.FakeComputeProvider;
import gpufleet.orchestrator.testing.FakeWorkerProbe;
import gpufleet.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Status endpoints served over a real socket against an in-memory store.
 */
class StatusServerIntegrationTest {

    private static final String DB_URL =
            "jdbc:h2:mem:test-status-server;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    private Dependencies deps;
    private FakeComputeProvider provider;
    private HttpClient http;
    private String baseUrl;

    @BeforeEach
    void setup() throws Exception {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withWorkerBounds(1, 3)
                .withStatusPort(0)
                .withDatabaseUrl(DB_URL);
        provider = new FakeComputeProvider();
        deps = Dependencies.create(config, provider, new FakeWorkerProbe(),
                new MutableClock(Instant.parse("2026-01-01T12:00:00Z")));

        try (var conn = deps.database().getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            st.execute("DELETE FROM workers");
            conn.commit();
        }

        int port = deps.statusServer().start(0);
        baseUrl = "http://127.0.0.1:" + port;
        http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void teardown() {
        if (deps != null)
            deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> resp) throws Exception {
        return RouterHandler.mapper().readTree(resp.body());
    }

    @Test
    void healthReportsDatabase() throws Exception {
        HttpResponse<String> resp = get("/api/v1/health");

        assertEquals(200, resp.statusCode());
        assertTrue(resp.headers().firstValue("content-type").orElse("").startsWith("application/json"));
        JsonNode body = json(resp);
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals(0, body.get("cycles").asInt());
    }

    @Test
    void lastCycleIsNotFoundBeforeFirstRun() throws Exception {
        assertEquals(404, get("/api/v1/cycles/last").statusCode());
    }

    @Test
    void endpointsReflectCycle() throws Exception {
        deps.taskRepository().save(Task.builder().id("t1").taskType("image_gen")
                .createdAt(Instant.parse("2026-01-01T11:59:00Z")).build());

        CycleSummary summary = deps.orchestrator().runCycle();
        assertTrue(summary.isSuccess());

        HttpResponse<String> last = get("/api/v1/cycles/last");
        assertEquals(200, last.statusCode());
        JsonNode cycle = json(last);
        assertEquals(1, cycle.get("cycle").asInt());
        assertEquals(1, cycle.get("actions").get("workersSpawned").asInt());

        JsonNode fleet = json(get("/api/v1/fleet"));
        assertEquals(1, fleet.get("workers").get("SPAWNING").asInt());
        assertEquals(1, fleet.get("tasks").get("queued").asInt());

        JsonNode health = json(get("/api/v1/health"));
        assertEquals(1, health.get("cycles").asInt());
        assertEquals("2026-01-01T12:00:00Z", health.get("lastScaleUp").asText());
        assertEquals(1, provider.spawnRequests().size());
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        HttpResponse<String> resp = get("/api/v1/nope?x=1");

        assertEquals(404, resp.statusCode());
        assertEquals("not found", json(resp).get("error").asText());
    }
}
