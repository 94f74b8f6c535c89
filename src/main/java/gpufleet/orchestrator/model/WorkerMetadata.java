package gpufleet.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Typed worker metadata. Every change goes through a {@code with*} copy and is
 * persisted together with the worker's version check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerMetadata(
        String instanceId,
        WorkerStatus orchestratorStatus,
        Integer ramTierGb,
        String storageVolume,
        String host,
        Integer sshPort,
        String errorReason,
        Instant errorTime,
        WorkerDiagnostics diagnostics,
        Instant promotedAt,
        Instant terminatedAt,
        TerminationReason terminationReason) {

    public static WorkerMetadata empty() {
        return new WorkerMetadata(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public WorkerMetadata withInstance(String instanceId, Integer ramTierGb, String storageVolume) {
        return new WorkerMetadata(instanceId, orchestratorStatus, ramTierGb, storageVolume, host, sshPort,
                errorReason, errorTime, diagnostics, promotedAt, terminatedAt, terminationReason);
    }

    public WorkerMetadata withOrchestratorStatus(WorkerStatus status) {
        return new WorkerMetadata(instanceId, status, ramTierGb, storageVolume, host, sshPort,
                errorReason, errorTime, diagnostics, promotedAt, terminatedAt, terminationReason);
    }

    public WorkerMetadata withEndpoint(String host, Integer sshPort) {
        return new WorkerMetadata(instanceId, orchestratorStatus, ramTierGb, storageVolume, host, sshPort,
                errorReason, errorTime, diagnostics, promotedAt, terminatedAt, terminationReason);
    }

    public WorkerMetadata withPromotion(Instant promotedAt) {
        return new WorkerMetadata(instanceId, WorkerStatus.ACTIVE, ramTierGb, storageVolume, host, sshPort,
                errorReason, errorTime, diagnostics, promotedAt, terminatedAt, terminationReason);
    }

    /** Diagnostics are kept from the first error only. */
    public WorkerMetadata withError(String reason, Instant at, WorkerDiagnostics snapshot) {
        WorkerDiagnostics kept = diagnostics != null ? diagnostics : snapshot;
        return new WorkerMetadata(instanceId, WorkerStatus.ERROR, ramTierGb, storageVolume, host, sshPort,
                reason, at, kept, promotedAt, terminatedAt, terminationReason);
    }

    public WorkerMetadata withTermination(TerminationReason reason, Instant at) {
        return new WorkerMetadata(instanceId, WorkerStatus.TERMINATED, ramTierGb, storageVolume, host, sshPort,
                errorReason, errorTime, diagnostics, promotedAt, at, reason);
    }

    public boolean hasInstance() {
        return instanceId != null && !instanceId.isBlank();
    }
}
