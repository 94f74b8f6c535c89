package gpufleet.orchestrator.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable counters for the cycle in progress.
 */
final class CycleTally {

    int promoted;
    int failed;
    int spawned;
    int terminated;
    int tasksReset;
    int tasksExhausted;
    int orphanedInstances;
    int remoteFailures;

    int queued;
    int inProgress;
    int spawning;
    int active;
    int idle;
    int busy;
    ScalingDecision decision = new ScalingDecision(0, 0, 0);
    BreakerDecision breaker;
    boolean reconciled;

    void add(RecoveryResult result) {
        tasksReset += result.reset();
        tasksExhausted += result.exhausted();
    }

    CycleSummary toSummary(long cycle, Instant started, Instant finished, int idleBufferTarget, String error) {
        return new CycleSummary(
                started,
                cycle,
                Duration.between(started, finished).toMillis(),
                new CycleSummary.Actions(promoted, failed, spawned, terminated, tasksReset, tasksExhausted,
                        orphanedInstances, remoteFailures),
                new CycleSummary.Status(queued, inProgress, spawning, active, idle, busy,
                        decision.desired(), decision.taskBased(), decision.bufferBased(), idleBufferTarget),
                breaker,
                reconciled,
                error);
    }
}
