package gpufleet.orchestrator.provider;

/**
 * Accepted spawn. The instance exists but is not yet usable.
 */
public record SpawnResult(String instanceId, int ramTierGb, String storageVolume) {
}
