package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.TaskStatus;
import gpufleet.orchestrator.store.Database;
import gpufleet.orchestrator.store.JdbcTaskRepository;
import gpufleet.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrphanedTaskRecoveryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private static Database db;
    private static OrchestratorConfig config;
    private MutableClock clock;
    private JdbcTaskRepository tasks;
    private OrphanedTaskRecovery recovery;

    @BeforeAll
    static void setupDb() {
        config = OrchestratorConfig.defaults()
                .withMaxTaskAttempts(3)
                .withLongRunningTaskTypes(Set.of("travel_orchestrator"))
                .withDatabaseUrl("jdbc:h2:mem:test-recovery;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        clock = new MutableClock(NOW);
        tasks = new JdbcTaskRepository(db, clock);
        recovery = new OrphanedTaskRecovery(tasks, new TaskTypeClassifier(config.longRunningTaskTypes()),
                config, clock);
    }

    private void inProgress(String id, String type, String workerId, int attempts, Instant startedAt) {
        tasks.save(Task.builder()
                .id(id)
                .taskType(type)
                .status(TaskStatus.IN_PROGRESS)
                .workerId(workerId)
                .attempts(attempts)
                .createdAt(NOW.minus(Duration.ofHours(1)))
                .generationStartedAt(startedAt)
                .build());
    }

    @Test
    void resetsRetryableTaskKeepingAttempts() {
        inProgress("t1", "image_gen", "gpu-dead", 1, NOW.minusSeconds(60));

        RecoveryResult result = recovery.recoverForWorkers(List.of("gpu-dead"), "worker died");

        assertEquals(1, result.reset());
        Task t = tasks.findById("t1").orElseThrow();
        assertEquals(TaskStatus.QUEUED, t.status());
        assertEquals(1, t.attempts());
        assertNull(t.workerId());
        assertNull(t.generationStartedAt());
        assertTrue(t.errorMessage().contains("worker died"));
    }

    @Test
    void exhaustedTaskIsFailedNotRequeued() {
        inProgress("t1", "image_gen", "gpu-dead", 3, NOW.minusSeconds(60));

        RecoveryResult result = recovery.recoverForWorkers(List.of("gpu-dead"), "worker died");

        assertEquals(0, result.reset());
        assertEquals(1, result.exhausted());
        Task t = tasks.findById("t1").orElseThrow();
        assertEquals(TaskStatus.FAILED, t.status());
        assertTrue(t.errorMessage().contains("max attempts exceeded"));
    }

    @Test
    void longRunningTasksAreLeftAlone() {
        inProgress("t1", "travel_orchestrator", "gpu-dead", 1, NOW.minusSeconds(60));

        RecoveryResult result = recovery.recoverForWorkers(List.of("gpu-dead"), "worker died");

        assertEquals(1, result.exempt());
        assertEquals(TaskStatus.IN_PROGRESS, tasks.findById("t1").orElseThrow().status());
    }

    @Test
    void tasksOfLiveWorkersAreNotTouched() {
        inProgress("t1", "image_gen", "gpu-alive", 1, NOW.minusSeconds(60));

        assertEquals(RecoveryResult.NONE, recovery.recoverForWorkers(List.of("gpu-dead"), "worker died"));
        assertEquals(RecoveryResult.NONE, recovery.recoverForWorkers(List.of(), "nothing"));
        assertEquals(TaskStatus.IN_PROGRESS, tasks.findById("t1").orElseThrow().status());
    }

    @Test
    void secondPassResetsNothing() {
        inProgress("t1", "image_gen", "gpu-dead", 1, NOW.minusSeconds(60));

        assertEquals(1, recovery.recoverForWorkers(List.of("gpu-dead"), "worker died").reset());
        assertEquals(0, recovery.recoverForWorkers(List.of("gpu-dead"), "worker died").reset());
    }

    @Test
    void reclaimedTaskIsNotResetFromStaleView() {
        inProgress("t1", "image_gen", "gpu-dead", 1, NOW.minusSeconds(60));
        Task stale = tasks.findById("t1").orElseThrow();

        // another worker got it in between
        tasks.resetToQueued("t1", "gpu-dead", 3, "manual");
        tasks.claimNext("gpu-new");

        assertFalse(tasks.resetToQueued(stale.id(), stale.workerId(), 3, "late"));
        assertEquals("gpu-new", tasks.findById("t1").orElseThrow().workerId());
    }

    @Test
    void unassignedTasksRecoveredAfterTimeout() {
        inProgress("old", "image_gen", null, 1, NOW.minus(Duration.ofMinutes(20)));
        inProgress("recent", "image_gen", null, 1, NOW.minus(Duration.ofMinutes(5)));

        RecoveryResult result = recovery.recoverUnassigned();

        assertEquals(1, result.reset());
        assertEquals(TaskStatus.QUEUED, tasks.findById("old").orElseThrow().status());
        assertEquals(TaskStatus.IN_PROGRESS, tasks.findById("recent").orElseThrow().status());
    }
}
