package gpufleet.orchestrator.store;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.TerminationReason;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerDiagnostics;
import gpufleet.orchestrator.model.WorkerMetadata;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWorkerRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private static Database db;
    private MutableClock clock;
    private JdbcWorkerRepository repo;

    @BeforeAll
    static void setup() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-workers;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanWorkers() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM workers");
            conn.commit();
        }
        clock = new MutableClock(NOW);
        repo = new JdbcWorkerRepository(db, clock);
    }

    @Test
    void insertAlwaysStoresInactive() {
        Worker inserted = repo.insert(Worker.builder()
                .id("gpu-w1")
                .status(WorkerStatus.ACTIVE)
                .createdAt(NOW)
                .metadata(WorkerMetadata.empty().withOrchestratorStatus(WorkerStatus.SPAWNING))
                .build());

        assertEquals(WorkerStatus.INACTIVE, inserted.status());
        assertEquals(0, inserted.version());

        Worker found = repo.findById("gpu-w1").orElseThrow();
        assertEquals(WorkerStatus.INACTIVE, found.status());
        assertEquals(WorkerStatus.SPAWNING, found.metadata().orchestratorStatus());
        assertEquals(WorkerStatus.SPAWNING, found.effectiveStatus());
        assertNull(found.lastHeartbeat());
        assertEquals(NOW, found.createdAt());
    }

    @Test
    void updateMovesForwardAndBumpsVersion() {
        Worker w = repo.insert(Worker.builder().id("gpu-w1").createdAt(NOW).build());
        clock.advance(Duration.ofSeconds(30));

        Optional<Worker> spawning = repo.update(w, WorkerStatus.SPAWNING,
                w.metadata().withInstance("inst-1", 60, "network-ssd:200gb"));

        assertTrue(spawning.isPresent());
        assertEquals(1, spawning.get().version());

        Worker found = repo.findById("gpu-w1").orElseThrow();
        assertEquals(WorkerStatus.SPAWNING, found.status());
        assertEquals("inst-1", found.instanceId());
        assertEquals(60, found.metadata().ramTierGb());
        assertEquals(NOW.plusSeconds(30), found.updatedAt());
        assertEquals(1, found.version());
    }

    @Test
    void updateWithStaleVersionIsRejected() {
        Worker w = repo.insert(Worker.builder().id("gpu-w1").createdAt(NOW).build());
        repo.update(w, WorkerStatus.SPAWNING, w.metadata().withInstance("inst-1", 48, "vol"));

        Optional<Worker> result = repo.update(w, WorkerStatus.ERROR, w.metadata());

        assertTrue(result.isEmpty());
        assertEquals(WorkerStatus.SPAWNING, repo.findById("gpu-w1").orElseThrow().status());
    }

    @Test
    void backwardTransitionThrows() {
        Worker w = repo.insert(Worker.builder().id("gpu-w1").createdAt(NOW).build());
        Worker active = repo.update(w, WorkerStatus.ACTIVE, w.metadata()).orElseThrow();

        assertThrows(IllegalStateException.class,
                () -> repo.update(active, WorkerStatus.SPAWNING, active.metadata()));
    }

    @Test
    void diagnosticsRoundTripThroughJson() {
        Worker w = repo.insert(Worker.builder().id("gpu-w1").createdAt(NOW).build());
        WorkerDiagnostics diagnostics = new WorkerDiagnostics(NOW, "stale heartbeat with active task",
                NOW.minusSeconds(400), 400L, "inst-1", "RUNNING", List.of("t1", "t2"),
                Map.of("gpu", "GPU 0: NVIDIA A100"), null);

        repo.update(w, WorkerStatus.ERROR, w.metadata().withError("stale heartbeat", NOW, diagnostics));

        Worker found = repo.findById("gpu-w1").orElseThrow();
        assertEquals(diagnostics, found.metadata().diagnostics());
        assertEquals("stale heartbeat", found.metadata().errorReason());
        assertEquals(NOW, found.metadata().errorTime());
    }

    @Test
    void terminationReasonIsStored() {
        Worker w = repo.insert(Worker.builder().id("gpu-w1").createdAt(NOW).build());

        repo.update(w, WorkerStatus.TERMINATED, w.metadata().withTermination(TerminationReason.SCALED_DOWN, NOW));

        Worker found = repo.findById("gpu-w1").orElseThrow();
        assertEquals(TerminationReason.SCALED_DOWN, found.metadata().terminationReason());
        assertEquals(NOW, found.metadata().terminatedAt());
        assertEquals(WorkerStatus.TERMINATED, found.metadata().orchestratorStatus());
    }

    @Test
    void heartbeatDoesNotChangeVersion() {
        repo.insert(Worker.builder().id("gpu-w1").createdAt(NOW).build());

        repo.recordHeartbeat("gpu-w1", NOW.plusSeconds(5));

        Worker found = repo.findById("gpu-w1").orElseThrow();
        assertEquals(NOW.plusSeconds(5), found.lastHeartbeat());
        assertEquals(0, found.version());
    }

    @Test
    void findUpdatedSinceUsesUpdateTime() {
        repo.insert(Worker.builder().id("gpu-old").createdAt(NOW).build());
        clock.advance(Duration.ofHours(1));
        repo.insert(Worker.builder().id("gpu-new").createdAt(clock.instant()).build());

        List<Worker> recent = repo.findUpdatedSince(NOW.plus(Duration.ofMinutes(30)));

        assertEquals(1, recent.size());
        assertEquals("gpu-new", recent.get(0).id());
    }

    @Test
    void findAllOldestFirst() {
        Worker a = repo.insert(Worker.builder().id("gpu-a").createdAt(NOW).build());
        repo.insert(Worker.builder().id("gpu-b").createdAt(NOW.plusSeconds(1)).build());
        repo.update(a, WorkerStatus.SPAWNING, a.metadata());

        assertEquals(List.of(WorkerStatus.SPAWNING, WorkerStatus.INACTIVE),
                repo.findAll().stream().map(Worker::status).toList());
        assertEquals(List.of("gpu-a", "gpu-b"), repo.findAll().stream().map(Worker::id).toList());
    }
}
