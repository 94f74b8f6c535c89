package gpufleet.orchestrator.service;

/**
 * Health classification of a single worker.
 */
public enum Verdict {
    /** Spawning worker is reachable and can be promoted */
    READY,
    /** Spawning worker still initializing within its timeout */
    SPAWNING,
    /** Active worker doing or about to do work */
    HEALTHY,
    /** Active worker idle, but kept (recently idle or fleet at its floor) */
    IDLE,
    /** Active worker idle past the timeout while the fleet is above its floor */
    ELIGIBLE_FOR_TERMINATION,
    /** Active worker holding a task past the stuck-task timeout */
    STUCK,
    /** Worker must go through ERROR */
    DEAD;

    public boolean isDead() {
        return this == STUCK || this == DEAD;
    }
}
