package gpufleet.orchestrator.model;

/**
 * Why a worker reached TERMINATED.
 */
public enum TerminationReason {
    /** Idle worker released because the fleet was above the desired size */
    SCALED_DOWN,
    /** Spawning worker cancelled before it finished initializing */
    SPAWN_CANCELLED,
    /** Worker went through ERROR */
    FAILED,
    /** Instance disappeared on the provider side */
    EXTERNALLY_TERMINATED;

    /** Voluntary terminations are not failures and stay out of the failure-rate numerator. */
    public boolean isVoluntary() {
        return this == SCALED_DOWN || this == SPAWN_CANCELLED;
    }
}
