package gpufleet.orchestrator.service;

import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.model.Task;

import java.time.Instant;
import java.util.List;

/**
 * Observations about an ACTIVE worker gathered for one evaluation.
 *
 * @param assignedTasks  in-progress tasks owned by the worker
 * @param instance       provider view, null when the lookup failed
 * @param lastCompletion latest task completion by this worker, null if none
 * @param queuedCount    claimable tasks in the queue
 * @param activeCount    ACTIVE workers still considered alive this cycle
 */
public record ActiveWorkerState(
        List<Task> assignedTasks,
        InstanceInfo instance,
        Instant lastCompletion,
        int queuedCount,
        int activeCount) {

    public ActiveWorkerState {
        assignedTasks = List.copyOf(assignedTasks);
    }
}
