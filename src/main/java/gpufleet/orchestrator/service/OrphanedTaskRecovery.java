package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Puts tasks abandoned by dead workers back on the queue.
 *
 * For each in-progress task owned by a dead worker (or unassigned for too long):
 * - long-running task types are left alone
 * - if attempts < max attempts: reset to Queued, attempts unchanged
 * - otherwise: mark Failed, it is never retried again
 *
 * Every reset is conditional on the task still being in progress for the same
 * owner, so running the recovery twice resets nothing the second time.
 */
public class OrphanedTaskRecovery {

    private static final Logger log = LoggerFactory.getLogger(OrphanedTaskRecovery.class);

    private final TaskRepository taskRepository;
    private final TaskTypeClassifier classifier;
    private final int maxAttempts;
    private final Duration unassignedTimeout;
    private final Clock clock;

    public OrphanedTaskRecovery(TaskRepository taskRepository, TaskTypeClassifier classifier,
            OrchestratorConfig config, Clock clock) {
        this.taskRepository = taskRepository;
        this.classifier = classifier;
        this.maxAttempts = config.maxTaskAttempts();
        this.unassignedTimeout = config.unassignedOrphanTimeout();
        this.clock = clock;
    }

    /**
     * Recover in-progress tasks owned by the given dead workers.
     */
    public RecoveryResult recoverForWorkers(Collection<String> deadWorkerIds, String reason) {
        if (deadWorkerIds.isEmpty()) {
            return RecoveryResult.NONE;
        }
        return recover(taskRepository.findInProgressByWorkers(deadWorkerIds), reason);
    }

    /**
     * Recover in-progress tasks that lost their worker id and have been
     * running longer than the unassigned-orphan timeout.
     */
    public RecoveryResult recoverUnassigned() {
        Instant cutoff = clock.instant().minus(unassignedTimeout);
        return recover(taskRepository.findUnassignedInProgress(cutoff),
                "unassigned for more than " + unassignedTimeout.toMinutes() + " min");
    }

    private RecoveryResult recover(List<Task> orphans, String reason) {
        if (orphans.isEmpty()) {
            return RecoveryResult.NONE;
        }

        int reset = 0;
        int exhausted = 0;
        int exempt = 0;

        for (Task task : orphans) {
            if (classifier.isExempt(task)) {
                exempt++;
                log.debug("Leaving long-running task {} ({}) untouched", task.id(), task.taskType());
                continue;
            }
            if (task.canRetry(maxAttempts)) {
                if (taskRepository.resetToQueued(task.id(), task.workerId(), maxAttempts, "Reset: " + reason)) {
                    reset++;
                    log.info("Re-queued orphaned task {} (attempt {} of {}): {}",
                            task.id(), task.attempts(), maxAttempts, reason);
                }
            } else {
                String message = "Orphaned (" + reason + ") - max attempts exceeded ("
                        + task.attempts() + "/" + maxAttempts + ")";
                if (taskRepository.markFailed(task.id(), message)) {
                    exhausted++;
                    log.warn("Task {} permanently failed after {} attempts (orphaned)", task.id(), task.attempts());
                }
            }
        }

        if (reset + exhausted > 0) {
            log.info("Orphan recovery: {} re-queued, {} failed, {} exempt, {} found",
                    reset, exhausted, exempt, orphans.size());
        }
        return new RecoveryResult(reset, exhausted, exempt);
    }
}
