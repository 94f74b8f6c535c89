package gpufleet.orchestrator.provider;

import gpufleet.orchestrator.model.InstanceInfo;

import java.util.List;
import java.util.Optional;

/**
 * Cloud side of the fleet: creates, inspects and deletes worker instances.
 * Implementations enforce their own per-call timeout and report failures as
 * {@link ProviderException}.
 */
public interface ComputeProvider {

    /**
     * Request a new instance. Returns as soon as the provider has accepted the
     * request; the instance is still provisioning.
     */
    SpawnResult spawn(SpawnRequest request);

    /**
     * Current state of an instance.
     *
     * @return empty if the provider does not know the id (deleted or never existed)
     */
    Optional<InstanceInfo> getInstance(String instanceId);

    /**
     * Request deletion. Deleting an instance that is already gone is not an error.
     */
    void terminate(String instanceId);

    /**
     * All instances whose name starts with the given prefix.
     */
    List<InstanceInfo> listInstances(String namePrefix);
}
