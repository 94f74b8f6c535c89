package gpufleet.orchestrator.service;

/**
 * Counters from one orphaned-task recovery pass.
 *
 * @param reset     tasks put back on the queue
 * @param exhausted tasks at the attempt cap, moved to Failed
 * @param exempt    long-running tasks left alone
 */
public record RecoveryResult(int reset, int exhausted, int exempt) {

    public static final RecoveryResult NONE = new RecoveryResult(0, 0, 0);

    public RecoveryResult plus(RecoveryResult other) {
        return new RecoveryResult(reset + other.reset, exhausted + other.exhausted, exempt + other.exempt);
    }
}
