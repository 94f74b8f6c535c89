package gpufleet.orchestrator.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Long-lived state of one fleet's control loop. One instance per fleet, so
 * several fleets can run in the same process.
 */
public class OrchestratorContext {

    private volatile long cycleCount;
    private volatile Instant lastScaleUpAt;
    private volatile Instant lastScaleDownAt;
    private int lastWorkload = -1;
    private volatile CycleSummary lastSummary;

    long nextCycle() {
        return ++cycleCount;
    }

    public long cycleCount() {
        return cycleCount;
    }

    public Instant lastScaleUpAt() {
        return lastScaleUpAt;
    }

    public Instant lastScaleDownAt() {
        return lastScaleDownAt;
    }

    public CycleSummary lastSummary() {
        return lastSummary;
    }

    void recordScaleUp(Instant at) {
        this.lastScaleUpAt = at;
    }

    void recordScaleDown(Instant at) {
        this.lastScaleDownAt = at;
    }

    /**
     * @return the workload recorded by the previous cycle, or -1 on the first
     */
    int recordWorkload(int workload) {
        int previous = lastWorkload;
        lastWorkload = workload;
        return previous;
    }

    void recordSummary(CycleSummary summary) {
        this.lastSummary = summary;
    }

    boolean inScaleDownCooldown(Instant now, Duration cooldown) {
        return lastScaleDownAt != null && Duration.between(lastScaleDownAt, now).compareTo(cooldown) < 0;
    }
}
