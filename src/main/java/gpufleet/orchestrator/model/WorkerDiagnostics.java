package gpufleet.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot collected once, when a worker enters ERROR.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerDiagnostics(
        Instant collectedAt,
        String reason,
        Instant lastHeartbeat,
        Long heartbeatAgeSeconds,
        String instanceId,
        String instanceState,
        List<String> runningTaskIds,
        Map<String, String> probeOutput,
        String probeError) {
}
