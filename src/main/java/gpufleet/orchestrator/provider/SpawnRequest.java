package gpufleet.orchestrator.provider;

import java.util.List;
import java.util.Map;

/**
 * Request for one worker instance.
 *
 * @param workerId   worker id, used as the instance name
 * @param ramTiersGb RAM sizes to try, in order, until one has capacity
 * @param labels     provider labels attached to the instance
 */
public record SpawnRequest(String workerId, List<Integer> ramTiersGb, Map<String, String> labels) {

    public SpawnRequest {
        if (ramTiersGb == null || ramTiersGb.isEmpty()) {
            throw new IllegalArgumentException("at least one RAM tier is required");
        }
        ramTiersGb = List.copyOf(ramTiersGb);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
