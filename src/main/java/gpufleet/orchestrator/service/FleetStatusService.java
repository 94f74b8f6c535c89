package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.TaskCounts;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.repository.TaskRepository;
import gpufleet.orchestrator.repository.WorkerRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds fleet snapshots from the state store alone; no provider calls,
 * so verdicts here ignore instance liveness.
 */
public class FleetStatusService {

    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;
    private final HealthEvaluator health;
    private final Clock clock;

    public FleetStatusService(WorkerRepository workerRepository, TaskRepository taskRepository,
            OrchestratorConfig config, Clock clock) {
        this.workerRepository = workerRepository;
        this.taskRepository = taskRepository;
        this.health = new HealthEvaluator(config, new TaskTypeClassifier(config.longRunningTaskTypes()), clock);
        this.clock = clock;
    }

    public FleetSnapshot snapshot() {
        Instant now = clock.instant();
        List<Worker> workers = workerRepository.findAll();
        TaskCounts counts = taskRepository.countWorkload();

        Map<WorkerStatus, Integer> byStatus = new EnumMap<>(WorkerStatus.class);
        for (WorkerStatus status : WorkerStatus.values()) {
            byStatus.put(status, 0);
        }
        List<Worker> active = new ArrayList<>();
        for (Worker worker : workers) {
            byStatus.merge(worker.status(), 1, Integer::sum);
            if (worker.status() == WorkerStatus.ACTIVE) {
                active.add(worker);
            }
        }

        List<FleetSnapshot.ActiveWorker> views = new ArrayList<>();
        for (Worker worker : active) {
            List<Task> tasks = taskRepository.findInProgressByWorker(worker.id());
            Instant lastCompletion = taskRepository.lastCompletionAt(worker.id()).orElse(null);
            HealthVerdict verdict = health.evaluateActive(worker,
                    new ActiveWorkerState(tasks, null, lastCompletion, counts.queued(), active.size()));
            views.add(new FleetSnapshot.ActiveWorker(
                    worker.id(),
                    worker.instanceId(),
                    worker.lastHeartbeat() != null ? Duration.between(worker.lastHeartbeat(), now).toSeconds() : null,
                    tasks.stream().map(Task::id).toList(),
                    verdict.verdict(),
                    verdict.reason()));
        }

        return new FleetSnapshot(now, byStatus, counts, views);
    }
}
