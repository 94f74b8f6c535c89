package gpufleet.orchestrator.service;

/**
 * Result of one desired-size computation.
 *
 * @param desired     target fleet size, always within the configured bounds
 * @param taskBased   workers needed for queued plus in-progress work
 * @param bufferBased busy workers plus the idle buffer
 */
public record ScalingDecision(int desired, int taskBased, int bufferBased) {
}
