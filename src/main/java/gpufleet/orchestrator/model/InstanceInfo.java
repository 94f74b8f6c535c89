package gpufleet.orchestrator.model;

/**
 * Provider view of one instance.
 *
 * @param instanceId provider id
 * @param name       instance name (equals the worker id for instances we created)
 * @param state      normalized state
 * @param host       reachable address, null until assigned
 * @param sshPort    SSH port, null until known
 */
public record InstanceInfo(
        String instanceId,
        String name,
        InstanceState state,
        String host,
        Integer sshPort) {

    /** Placeholder for an id the provider no longer knows about. */
    public static InstanceInfo missing(String instanceId) {
        return new InstanceInfo(instanceId, null, InstanceState.TERMINATED, null, null);
    }

    public boolean isRunning() {
        return state == InstanceState.RUNNING;
    }

    public boolean hasEndpoint() {
        return host != null && !host.isBlank();
    }
}
