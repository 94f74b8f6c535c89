package gpufleet.orchestrator.model;

/**
 * Workload counters as seen by claiming workers.
 */
public record TaskCounts(int queued, int inProgress) {

    public int total() {
        return queued + inProgress;
    }
}
