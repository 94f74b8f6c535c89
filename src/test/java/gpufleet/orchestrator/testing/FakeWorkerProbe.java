package gpufleet.orchestrator.testing;

import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.provider.ProviderException;
import gpufleet.orchestrator.provider.WorkerProbe;

import java.util.Map;

public class FakeWorkerProbe implements WorkerProbe {

    public boolean ready = true;
    public boolean failDiagnostics;
    public int diagnosticCalls;

    @Override
    public boolean checkReady(InstanceInfo instance) {
        return ready;
    }

    @Override
    public Map<String, String> runDiagnosticProbe(InstanceInfo instance) {
        diagnosticCalls++;
        if (failDiagnostics) {
            throw new ProviderException("ssh: connect timed out");
        }
        return Map.of("gpu", "GPU 0: NVIDIA A100", "uptime", "up 2 hours");
    }
}
