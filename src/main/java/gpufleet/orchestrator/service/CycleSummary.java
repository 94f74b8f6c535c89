package gpufleet.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Structured result of one control-loop cycle, emitted even when the cycle
 * failed part way ({@code error} is then set).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleSummary(
        Instant timestamp,
        long cycle,
        long durationMs,
        Actions actions,
        Status status,
        BreakerDecision breaker,
        boolean reconciliationRan,
        String error) {

    public record Actions(
            int workersPromoted,
            int workersFailed,
            int workersSpawned,
            int workersTerminated,
            int tasksReset,
            int tasksExhausted,
            int orphanedInstancesTerminated,
            int remoteCallFailures) {
    }

    public record Status(
            int queued,
            int inProgress,
            int spawning,
            int active,
            int idle,
            int busy,
            int desired,
            int taskBased,
            int bufferBased,
            int idleBufferTarget) {
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
