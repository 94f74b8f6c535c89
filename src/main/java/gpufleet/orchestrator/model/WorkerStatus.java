package gpufleet.orchestrator.model;

/**
 * Worker lifecycle status.
 * Declaration order is the lifecycle order: a worker only ever moves forward.
 */
public enum WorkerStatus {
    /** Row registered, provider instance not yet requested or confirmed */
    INACTIVE,
    /** Instance requested, waiting for it to become reachable */
    SPAWNING,
    /** Worker is up and pulling tasks */
    ACTIVE,
    /** Worker failed; cleanup pending */
    ERROR,
    /** Final state, instance released */
    TERMINATED;

    /**
     * Check whether a move from this status to {@code target} is a forward step.
     */
    public boolean canTransitionTo(WorkerStatus target) {
        return target.ordinal() > this.ordinal();
    }

    public boolean isLive() {
        return this == SPAWNING || this == ACTIVE;
    }

    public boolean isFinal() {
        return this == TERMINATED;
    }
}
