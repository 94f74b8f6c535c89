package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;

/**
 * Computes how many workers should exist. Stateless; every input comes from the caller.
 */
public class ScalingDecisionEngine {

    private final int minWorkers;
    private final int maxWorkers;
    private final double scaleUpMultiplier;
    private final double scaleDownMultiplier;
    private final int idleBufferTarget;

    public ScalingDecisionEngine(OrchestratorConfig config) {
        this.minWorkers = config.minWorkers();
        this.maxWorkers = config.maxWorkers();
        this.scaleUpMultiplier = config.scaleUpMultiplier();
        this.scaleDownMultiplier = config.scaleDownMultiplier();
        this.idleBufferTarget = config.idleBufferTarget();
    }

    /**
     * Desired worker count:
     * {@code clamp(max(min, ceil(workload * up), busy + idleBuffer), min, max)}.
     * Any work at all yields a task-based count of at least one.
     */
    public ScalingDecision decide(int queued, int inProgress, int idle, int busy) {
        int workload = queued + inProgress;
        int taskBased = workload > 0 ? Math.max(1, scaled(workload, scaleUpMultiplier)) : 0;
        int bufferBased = busy + idleBufferTarget;
        int desired = clamp(Math.max(minWorkers, Math.max(taskBased, bufferBased)));
        return new ScalingDecision(desired, taskBased, bufferBased);
    }

    /**
     * Conservative target used only to cancel surplus still-spawning workers.
     * Uses the scale-down multiplier and the idle buffer alone, so it never
     * exceeds what {@link #decide} would ask for.
     */
    public int earlyTerminationTarget(int queued, int inProgress) {
        int workload = queued + inProgress;
        int taskBased = workload > 0 ? Math.max(1, scaled(workload, scaleDownMultiplier)) : 0;
        return clamp(Math.max(minWorkers, Math.max(taskBased, idleBufferTarget)));
    }

    public int idleBufferTarget() {
        return idleBufferTarget;
    }

    private int clamp(int value) {
        return Math.max(minWorkers, Math.min(value, maxWorkers));
    }

    private static int scaled(int workload, double multiplier) {
        return (int) Math.ceil(workload * multiplier);
    }
}
