package gpufleet.orchestrator.repository;

import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerMetadata;
import gpufleet.orchestrator.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for worker persistence.
 */
public interface WorkerRepository {

    /**
     * Register a new worker. The row is always stored as INACTIVE.
     *
     * @param worker the worker to insert
     * @return the stored worker
     */
    Worker insert(Worker worker);

    /**
     * Find a worker by ID.
     *
     * @param workerId the worker ID
     * @return the worker if found
     */
    Optional<Worker> findById(String workerId);

    /**
     * Get all workers, oldest first.
     */
    List<Worker> findAll();

    /**
     * Workers whose row changed at or after the given time.
     */
    List<Worker> findUpdatedSince(Instant since);

    /**
     * Conditionally move a worker to a new status with new metadata.
     * Succeeds only if the stored version still equals {@code current.version()},
     * so a concurrent writer makes this a no-op instead of a lost update.
     * Staying in the same status (metadata-only update) is allowed; moving
     * backwards is not.
     *
     * @param current  the worker as last read
     * @param status   target status
     * @param metadata metadata to store
     * @return the updated worker, or empty if the version check failed
     * @throws IllegalStateException if the status would move backwards
     */
    Optional<Worker> update(Worker current, WorkerStatus status, WorkerMetadata metadata);

    /**
     * Record a heartbeat. Part of the worker agents' side of the shared store:
     * workers call it, the orchestrator only reads the column.
     */
    void recordHeartbeat(String workerId, Instant at);
}
