package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.model.InstanceState;
import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.Worker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Classifies workers from heartbeat, assigned tasks and instance state.
 *
 * <p>ACTIVE workers are checked in this order:
 * <ol>
 * <li>provider liveness: instance gone or failed is DEAD</li>
 * <li>assigned task with a stale or missing heartbeat is DEAD</li>
 * <li>non-exempt assigned task older than the stuck-task timeout is STUCK</li>
 * <li>no task while work is queued and heartbeat stale (or never sent) is DEAD</li>
 * <li>no task and empty queue: idle past the idle timeout is ELIGIBLE_FOR_TERMINATION
 * only while more than {@code min_workers} are active</li>
 * </ol>
 *
 * <p>The idle period starts at the first available of: last task completion,
 * promotion time, last heartbeat, creation time.
 */
public class HealthEvaluator {

    private final Duration idleTimeout;
    private final Duration stuckTaskTimeout;
    private final Duration spawningTimeout;
    private final int minWorkers;
    private final TaskTypeClassifier classifier;
    private final Clock clock;

    public HealthEvaluator(OrchestratorConfig config, TaskTypeClassifier classifier, Clock clock) {
        this.idleTimeout = config.idleTimeout();
        this.stuckTaskTimeout = config.stuckTaskTimeout();
        this.spawningTimeout = config.spawningTimeout();
        this.minWorkers = config.minWorkers();
        this.classifier = classifier;
        this.clock = clock;
    }

    /**
     * Evaluate a worker that has not been promoted yet.
     *
     * @param instance provider view, null when the lookup failed this cycle
     * @param ready    result of the readiness probe (false if it was not run)
     */
    public HealthVerdict evaluateSpawning(Worker worker, InstanceInfo instance, boolean ready) {
        String id = worker.id();
        Instant now = clock.instant();

        if (!worker.metadata().hasInstance()) {
            return HealthVerdict.of(id, Verdict.DEAD, "no instance id");
        }
        if (instance != null && instance.state() == InstanceState.FAILED) {
            return HealthVerdict.of(id, Verdict.DEAD, "instance failed during initialization");
        }
        if (instance != null && instance.state() == InstanceState.TERMINATED) {
            return HealthVerdict.of(id, Verdict.DEAD, "instance terminated during initialization");
        }
        if (instance != null && instance.isRunning() && ready) {
            return HealthVerdict.of(id, Verdict.READY, "instance running and reachable");
        }
        Duration age = worker.age(now);
        if (age.compareTo(spawningTimeout) > 0) {
            return HealthVerdict.of(id, Verdict.DEAD,
                    "spawning timeout after " + age.toSeconds() + "s");
        }
        return HealthVerdict.of(id, Verdict.SPAWNING,
                instance != null ? "instance " + instance.state() : "instance status unavailable");
    }

    public HealthVerdict evaluateActive(Worker worker, ActiveWorkerState state) {
        String id = worker.id();
        Instant now = clock.instant();

        InstanceInfo instance = state.instance();
        if (!worker.metadata().hasInstance()) {
            return HealthVerdict.of(id, Verdict.DEAD, "no instance id");
        }
        if (instance != null
                && (instance.state() == InstanceState.TERMINATED || instance.state() == InstanceState.FAILED)) {
            return HealthVerdict.of(id, Verdict.DEAD, "instance " + instance.state().name().toLowerCase(Locale.ROOT));
        }

        boolean heartbeatStale = isStale(worker.lastHeartbeat(), now);
        boolean hasTasks = !state.assignedTasks().isEmpty();

        if (hasTasks && heartbeatStale) {
            return HealthVerdict.of(id, Verdict.DEAD, "stale heartbeat with active task");
        }

        for (Task task : state.assignedTasks()) {
            if (classifier.isExempt(task) || task.generationStartedAt() == null) {
                continue;
            }
            Duration running = Duration.between(task.generationStartedAt(), now);
            if (running.compareTo(stuckTaskTimeout) > 0) {
                return HealthVerdict.of(id, Verdict.STUCK,
                        "stuck task " + task.id() + " running for " + running.toSeconds() + "s");
            }
        }

        if (hasTasks) {
            return HealthVerdict.of(id, Verdict.HEALTHY, "processing " + state.assignedTasks().size() + " task(s)");
        }

        if (state.queuedCount() > 0) {
            if (worker.lastHeartbeat() == null) {
                Instant reference = worker.metadata().promotedAt() != null
                        ? worker.metadata().promotedAt()
                        : worker.createdAt();
                if (reference != null && Duration.between(reference, now).compareTo(idleTimeout) > 0) {
                    return HealthVerdict.of(id, Verdict.DEAD, "idle with tasks queued (no heartbeat)");
                }
            } else if (heartbeatStale) {
                return HealthVerdict.of(id, Verdict.DEAD, "idle with tasks queued");
            }
            return HealthVerdict.of(id, Verdict.HEALTHY, "waiting to claim queued work");
        }

        Instant idleSince = idleSince(worker, state.lastCompletion());
        Duration idle = idleSince != null ? Duration.between(idleSince, now) : Duration.ZERO;
        if (idle.compareTo(idleTimeout) > 0 && state.activeCount() > minWorkers) {
            return new HealthVerdict(id, Verdict.ELIGIBLE_FOR_TERMINATION,
                    "idle for " + idle.toSeconds() + "s", idleSince);
        }
        return new HealthVerdict(id, Verdict.IDLE, "idle for " + idle.toSeconds() + "s", idleSince);
    }

    /**
     * Start of the current idle period.
     */
    public Instant idleSince(Worker worker, Instant lastCompletion) {
        if (lastCompletion != null) {
            return lastCompletion;
        }
        if (worker.metadata().promotedAt() != null) {
            return worker.metadata().promotedAt();
        }
        if (worker.lastHeartbeat() != null) {
            return worker.lastHeartbeat();
        }
        return worker.createdAt();
    }

    private boolean isStale(Instant heartbeat, Instant now) {
        return heartbeat == null || Duration.between(heartbeat, now).compareTo(idleTimeout) > 0;
    }
}
