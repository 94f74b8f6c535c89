package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.TerminationReason;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerMetadata;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.store.Database;
import gpufleet.orchestrator.store.JdbcWorkerRepository;
import gpufleet.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailureRateBreakerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private static Database db;
    private static OrchestratorConfig config;
    private MutableClock clock;
    private JdbcWorkerRepository workers;
    private FailureRateBreaker breaker;

    @BeforeAll
    static void setupDb() {
        config = OrchestratorConfig.defaults()
                .withFailureRate(0.8, Duration.ofMinutes(30), 5)
                .withDatabaseUrl("jdbc:h2:mem:test-breaker;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
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
            st.execute("DELETE FROM workers");
            conn.commit();
        }
        clock = new MutableClock(NOW);
        workers = new JdbcWorkerRepository(db, clock);
        breaker = new FailureRateBreaker(workers, config, clock);
    }

    private static Worker worker(String id, WorkerStatus status, TerminationReason reason) {
        WorkerMetadata metadata = reason != null
                ? WorkerMetadata.empty().withTermination(reason, NOW)
                : WorkerMetadata.empty();
        return Worker.builder().id(id).status(status).createdAt(NOW).metadata(metadata).build();
    }

    private static List<Worker> sample(int failed, int scaledDown, int active) {
        List<Worker> list = new ArrayList<>();
        for (int i = 0; i < failed; i++)
            list.add(worker("f" + i, WorkerStatus.TERMINATED, TerminationReason.FAILED));
        for (int i = 0; i < scaledDown; i++)
            list.add(worker("s" + i, WorkerStatus.TERMINATED, TerminationReason.SCALED_DOWN));
        for (int i = 0; i < active; i++)
            list.add(worker("a" + i, WorkerStatus.ACTIVE, null));
        return list;
    }

    private void storeTerminated(String id, TerminationReason reason) {
        Worker w = workers.insert(Worker.builder().id(id).createdAt(clock.instant()).build());
        workers.update(w, WorkerStatus.TERMINATED, w.metadata().withTermination(reason, clock.instant()));
    }

    @Test
    void smallSampleAlwaysAllows() {
        BreakerDecision d = breaker.decide(sample(4, 0, 0));

        assertTrue(d.allowed());
        assertEquals(4, d.sampleSize());
        assertTrue(d.reason().startsWith("insufficient data"));
    }

    @Test
    void blocksAboveMaxRate() {
        BreakerDecision d = breaker.decide(sample(5, 1, 0));

        assertTrue(d.blocked());
        assertEquals(6, d.sampleSize());
        assertEquals(5, d.failures());
        assertEquals(5.0 / 6, d.failureRate(), 1e-9);
    }

    @Test
    void rateAtThresholdIsAllowed() {
        BreakerDecision d = breaker.decide(sample(4, 0, 1));

        assertTrue(d.allowed());
        assertEquals(0.8, d.failureRate(), 1e-9);
    }

    @Test
    void voluntaryTerminationsAreNotFailures() {
        BreakerDecision d = breaker.decide(sample(0, 6, 0));

        assertTrue(d.allowed());
        assertEquals(0, d.failures());
        assertFalse(FailureRateBreaker.isFailure(worker("x", WorkerStatus.TERMINATED, TerminationReason.SPAWN_CANCELLED)));
        assertTrue(FailureRateBreaker.isFailure(worker("y", WorkerStatus.TERMINATED, TerminationReason.EXTERNALLY_TERMINATED)));
        assertTrue(FailureRateBreaker.isFailure(worker("z", WorkerStatus.ERROR, null)));
    }

    @Test
    void evaluateUsesWorkersInWindow() {
        for (int i = 0; i < 5; i++)
            storeTerminated("gpu-f" + i, TerminationReason.FAILED);
        storeTerminated("gpu-s0", TerminationReason.SCALED_DOWN);

        assertTrue(breaker.evaluate().blocked());
    }

    @Test
    void breakerClosesWhenFailuresLeaveWindow() {
        for (int i = 0; i < 6; i++)
            storeTerminated("gpu-f" + i, TerminationReason.FAILED);
        assertTrue(breaker.evaluate().blocked());

        clock.advance(Duration.ofMinutes(31));

        BreakerDecision d = breaker.evaluate();
        assertTrue(d.allowed());
        assertEquals(0, d.sampleSize());
    }
}
