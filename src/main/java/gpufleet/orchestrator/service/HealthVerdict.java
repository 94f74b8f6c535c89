package gpufleet.orchestrator.service;

import java.time.Instant;

/**
 * Outcome of a health evaluation. Never applied by the evaluator itself.
 *
 * @param workerId  evaluated worker
 * @param verdict   classification
 * @param reason    human-readable cause
 * @param idleSince start of the current idle period, null unless the worker is idle
 */
public record HealthVerdict(String workerId, Verdict verdict, String reason, Instant idleSince) {

    public static HealthVerdict of(String workerId, Verdict verdict, String reason) {
        return new HealthVerdict(workerId, verdict, reason, null);
    }

    public boolean isDead() {
        return verdict.isDead();
    }
}
