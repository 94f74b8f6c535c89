package gpufleet.orchestrator.repository;

import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.TaskCounts;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for task persistence.
 */
public interface TaskRepository {

    /**
     * Save a task (insert or replace). Used by producers and tests.
     */
    void save(Task task);

    /**
     * Find a task by ID.
     */
    Optional<Task> findById(String taskId);

    // Worker side. The GPU worker agents claim and finish tasks through these
    // three calls; the control loop never does. countWorkload() must count
    // exactly what claimNext() would hand out.

    /**
     * Claim the oldest claimable task for a worker: status becomes In Progress,
     * attempts is incremented, generation start time is set.
     *
     * @return the claimed task, or empty if nothing is claimable
     */
    Optional<Task> claimNext(String workerId);

    /**
     * Mark a task Complete. Only the owning worker may complete it.
     */
    boolean complete(String taskId, String workerId);

    /**
     * Mark a task Failed on behalf of its worker.
     */
    boolean fail(String taskId, String workerId, String errorMessage);

    /**
     * Queued and in-progress counts using the same eligibility filter as
     * {@link #claimNext(String)}.
     */
    TaskCounts countWorkload();

    /**
     * In-progress tasks currently assigned to a worker.
     */
    List<Task> findInProgressByWorker(String workerId);

    /**
     * In-progress tasks assigned to any of the given workers.
     */
    List<Task> findInProgressByWorkers(Collection<String> workerIds);

    /**
     * In-progress tasks with no worker that started before the cutoff.
     */
    List<Task> findUnassignedInProgress(Instant startedBefore);

    /**
     * Most recent completion time of a task processed by the worker.
     */
    Optional<Instant> lastCompletionAt(String workerId);

    /**
     * Put an in-progress task back on the queue: clears worker and timestamps,
     * keeps attempts, records the reason. Conditional on the task still being
     * In Progress, still owned by {@code expectedWorkerId} (null for unassigned)
     * and below the attempt cap.
     *
     * @return true if the task was reset
     */
    boolean resetToQueued(String taskId, String expectedWorkerId, int maxAttempts, String reason);

    /**
     * Mark an in-progress task as permanently Failed.
     *
     * @return true if the task was still In Progress
     */
    boolean markFailed(String taskId, String errorMessage);
}
