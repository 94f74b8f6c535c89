package gpufleet.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of the failure-rate check for one cycle.
 */
public record BreakerDecision(boolean allowed, int sampleSize, int failures, double failureRate, String reason) {

    @JsonIgnore
    public boolean blocked() {
        return !allowed;
    }
}
