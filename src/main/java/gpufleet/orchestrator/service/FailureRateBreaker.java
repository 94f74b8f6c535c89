package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.TerminationReason;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Blocks new spawns while the recent worker failure ratio is too high.
 * No state of its own: the window slides with the clock, so the breaker
 * closes again once failed workers age out.
 */
public class FailureRateBreaker {

    private static final Logger log = LoggerFactory.getLogger(FailureRateBreaker.class);

    private final WorkerRepository workerRepository;
    private final double maxFailureRate;
    private final Duration window;
    private final int minSample;
    private final Clock clock;

    public FailureRateBreaker(WorkerRepository workerRepository, OrchestratorConfig config, Clock clock) {
        this.workerRepository = workerRepository;
        this.maxFailureRate = config.maxFailureRate();
        this.window = config.failureWindow();
        this.minSample = config.minSampleForFailureRate();
        this.clock = clock;
    }

    /**
     * Evaluate against workers updated within the window.
     */
    public BreakerDecision evaluate() {
        Instant since = clock.instant().minus(window);
        BreakerDecision decision = decide(workerRepository.findUpdatedSince(since));
        if (decision.blocked()) {
            log.error("FAILURE-RATE BREAKER OPEN: {}/{} workers failed in the last {} min ({}% > {}%), spawning blocked",
                    decision.failures(), decision.sampleSize(), window.toMinutes(),
                    Math.round(decision.failureRate() * 100), Math.round(maxFailureRate * 100));
        }
        return decision;
    }

    /**
     * Decide over an already selected sample. Voluntary terminations
     * (scale-down, spawn cancellation) are part of the sample but not failures.
     */
    public BreakerDecision decide(List<Worker> sample) {
        int size = sample.size();
        int failures = (int) sample.stream().filter(FailureRateBreaker::isFailure).count();

        if (size < minSample) {
            return new BreakerDecision(true, size, failures, size == 0 ? 0.0 : (double) failures / size,
                    "insufficient data (" + size + " < " + minSample + ")");
        }

        double rate = (double) failures / size;
        if (rate > maxFailureRate) {
            return new BreakerDecision(false, size, failures, rate,
                    String.format(Locale.ROOT, "failure rate %.3f > %.3f", rate, maxFailureRate));
        }
        return new BreakerDecision(true, size, failures, rate,
                String.format(Locale.ROOT, "failure rate %.3f <= %.3f", rate, maxFailureRate));
    }

    static boolean isFailure(Worker worker) {
        if (worker.status() == WorkerStatus.ERROR) {
            return true;
        }
        if (worker.status() == WorkerStatus.TERMINATED) {
            TerminationReason reason = worker.metadata().terminationReason();
            return reason == null || !reason.isVoluntary();
        }
        return false;
    }
}
