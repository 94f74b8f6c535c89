package gpufleet.orchestrator.service;

import gpufleet.orchestrator.model.Worker;

import java.util.List;

/**
 * Outcome of one reconciliation sweep.
 *
 * @param performed                   false if the provider listing was unavailable
 * @param orphanedInstancesTerminated live instances with no worker row that were deleted
 * @param externallyTerminated        live workers whose instance is gone
 * @param remoteCallFailures          failed provider calls during the sweep
 */
public record ReconciliationResult(
        boolean performed,
        int orphanedInstancesTerminated,
        List<Worker> externallyTerminated,
        int remoteCallFailures) {

    public static ReconciliationResult skipped() {
        return new ReconciliationResult(false, 0, List.of(), 1);
    }
}
