package gpufleet.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import gpufleet.orchestrator.model.TaskCounts;
import gpufleet.orchestrator.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only picture of the fleet for the status command and endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FleetSnapshot(
        Instant timestamp,
        Map<WorkerStatus, Integer> workers,
        TaskCounts tasks,
        List<ActiveWorker> activeWorkers) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ActiveWorker(
            String id,
            String instanceId,
            Long heartbeatAgeSeconds,
            List<String> runningTaskIds,
            Verdict verdict,
            String reason) {
    }
}
