package gpufleet.orchestrator.model;

/**
 * Provider-side instance state, normalized across providers.
 */
public enum InstanceState {
    PROVISIONING,
    RUNNING,
    FAILED,
    TERMINATED,
    UNKNOWN;

    /** Counts as existing capacity for reconciliation. */
    public boolean isLive() {
        return this == PROVISIONING || this == RUNNING;
    }
}
