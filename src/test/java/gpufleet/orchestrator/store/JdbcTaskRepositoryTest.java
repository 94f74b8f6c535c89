package gpufleet.orchestrator.store;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.TaskCounts;
import gpufleet.orchestrator.model.TaskStatus;
import gpufleet.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private static Database db;
    private MutableClock clock;
    private JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-tasks;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        clock = new MutableClock(NOW);
        repo = new JdbcTaskRepository(db, clock);
    }

    private void queued(String id, Instant createdAt) {
        repo.save(Task.builder().id(id).taskType("image_gen").params("{\"prompt\":\"x\"}").createdAt(createdAt).build());
    }

    @Test
    void saveAndFindById() {
        queued("t1", NOW);

        Optional<Task> found = repo.findById("t1");
        assertTrue(found.isPresent());
        assertEquals("image_gen", found.get().taskType());
        assertEquals(TaskStatus.QUEUED, found.get().status());
        assertEquals(0, found.get().attempts());
        assertEquals("{\"prompt\":\"x\"}", found.get().params());
    }

    @Test
    void claimTakesOldestAndCountsAttempt() {
        queued("t2", NOW.plusSeconds(1));
        queued("t1", NOW);

        Task claimed = repo.claimNext("gpu-w1").orElseThrow();

        assertEquals("t1", claimed.id());
        assertEquals(1, claimed.attempts());
        Task stored = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.IN_PROGRESS, stored.status());
        assertEquals("gpu-w1", stored.workerId());
        assertEquals(NOW, stored.generationStartedAt());
    }

    @Test
    void claimOnEmptyQueue() {
        assertTrue(repo.claimNext("gpu-w1").isEmpty());
    }

    @Test
    void workloadCountsMatchClaimableFilter() {
        queued("t1", NOW);
        queued("t2", NOW);
        queued("t3", NOW);
        repo.claimNext("gpu-w1");
        Task done = repo.claimNext("gpu-w1").orElseThrow();
        repo.complete(done.id(), "gpu-w1");

        TaskCounts counts = repo.countWorkload();

        assertEquals(1, counts.queued());
        assertEquals(1, counts.inProgress());
        assertEquals(2, counts.total());
    }

    @Test
    void completeRequiresOwner() {
        queued("t1", NOW);
        repo.claimNext("gpu-w1");

        assertFalse(repo.complete("t1", "gpu-other"));
        assertTrue(repo.complete("t1", "gpu-w1"));
        assertEquals(TaskStatus.COMPLETE, repo.findById("t1").orElseThrow().status());
    }

    @Test
    void failRecordsError() {
        queued("t1", NOW);
        repo.claimNext("gpu-w1");

        assertFalse(repo.fail("t1", "gpu-other", "oom"));
        assertTrue(repo.fail("t1", "gpu-w1", "CUDA out of memory"));

        Task t = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.FAILED, t.status());
        assertEquals("CUDA out of memory", t.errorMessage());
        assertEquals(NOW, t.generationProcessedAt());
        // only in-progress tasks can fail
        assertFalse(repo.fail("t1", "gpu-w1", "again"));
    }

    @Test
    void lastCompletionAt() {
        queued("t1", NOW);
        queued("t2", NOW.plusSeconds(1));
        repo.claimNext("gpu-w1");
        repo.complete("t1", "gpu-w1");
        clock.advance(Duration.ofMinutes(5));
        repo.claimNext("gpu-w1");
        repo.complete("t2", "gpu-w1");

        assertEquals(Optional.of(NOW.plus(Duration.ofMinutes(5))), repo.lastCompletionAt("gpu-w1"));
        assertTrue(repo.lastCompletionAt("gpu-idle").isEmpty());
    }

    @Test
    void resetToQueuedKeepsAttempts() {
        queued("t1", NOW);
        repo.claimNext("gpu-w1");

        assertTrue(repo.resetToQueued("t1", "gpu-w1", 3, "Reset: worker died"));

        Task t = repo.findById("t1").orElseThrow();
        assertEquals(TaskStatus.QUEUED, t.status());
        assertEquals(1, t.attempts());
        assertNull(t.workerId());
        assertNull(t.generationStartedAt());
        assertEquals("Reset: worker died", t.errorMessage());
    }

    @Test
    void resetToQueuedIsConditional() {
        queued("t1", NOW);
        repo.claimNext("gpu-w1");

        assertFalse(repo.resetToQueued("t1", "gpu-other", 3, "wrong owner"));
        assertFalse(repo.resetToQueued("t1", "gpu-w1", 1, "at cap"));
        assertTrue(repo.resetToQueued("t1", "gpu-w1", 3, "ok"));
        assertFalse(repo.resetToQueued("t1", "gpu-w1", 3, "already queued"));
    }

    @Test
    void markFailedOnlyFromInProgress() {
        queued("t1", NOW);

        assertFalse(repo.markFailed("t1", "not running"));

        repo.claimNext("gpu-w1");
        assertTrue(repo.markFailed("t1", "max attempts"));
        assertEquals(TaskStatus.FAILED, repo.findById("t1").orElseThrow().status());
    }

    @Test
    void findInProgressByWorkers() {
        queued("t1", NOW);
        queued("t2", NOW.plusSeconds(1));
        queued("t3", NOW.plusSeconds(2));
        repo.claimNext("gpu-a");
        repo.claimNext("gpu-b");
        repo.claimNext("gpu-c");

        List<Task> found = repo.findInProgressByWorkers(List.of("gpu-a", "gpu-c"));

        assertEquals(2, found.size());
        assertEquals(1, repo.findInProgressByWorker("gpu-b").size());
        assertTrue(repo.findInProgressByWorkers(List.of()).isEmpty());
    }

    @Test
    void findUnassignedInProgressHonoursCutoff() {
        repo.save(Task.builder().id("t1").taskType("image_gen").status(TaskStatus.IN_PROGRESS)
                .attempts(1).generationStartedAt(NOW.minus(Duration.ofMinutes(30))).build());
        repo.save(Task.builder().id("t2").taskType("image_gen").status(TaskStatus.IN_PROGRESS)
                .attempts(1).generationStartedAt(NOW.minus(Duration.ofMinutes(1))).build());

        List<Task> found = repo.findUnassignedInProgress(NOW.minus(Duration.ofMinutes(15)));

        assertEquals(1, found.size());
        assertEquals("t1", found.get(0).id());
    }
}
