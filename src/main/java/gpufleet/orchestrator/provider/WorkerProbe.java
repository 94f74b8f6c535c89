package gpufleet.orchestrator.provider;

import gpufleet.orchestrator.model.InstanceInfo;

import java.util.Map;

/**
 * Remote checks executed on a worker instance.
 */
public interface WorkerProbe {

    /**
     * Whether the instance is reachable and able to take work.
     *
     * @throws ProviderException on transport failure or timeout
     */
    boolean checkReady(InstanceInfo instance);

    /**
     * Collect best-effort diagnostics (named command outputs).
     *
     * @throws ProviderException on transport failure or timeout
     */
    Map<String, String> runDiagnosticProbe(InstanceInfo instance);
}
