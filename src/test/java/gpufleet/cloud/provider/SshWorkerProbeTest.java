package gpufleet.cloud.provider;

import gpufleet.cloud.config.CloudConfig;
import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.model.InstanceState;
import gpufleet.orchestrator.provider.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SshWorkerProbeTest {

    private CloudConfig cfg;

    @BeforeEach
    void setup() {
        cfg = new CloudConfig();
        cfg.sshUser = "ubuntu";
        cfg.sshPort = 22;
        cfg.workerLogPath = "/var/log/gpu-worker.log";
    }

    @Test
    void buildsNonInteractiveSshCommand() {
        cfg.sshPrivateKeyPath = "/keys/fleet";
        SshWorkerProbe probe = new SshWorkerProbe(cfg, Duration.ofSeconds(15));
        InstanceInfo instance = new InstanceInfo("i-1", "gpu-a", InstanceState.RUNNING, "10.0.0.5", 2222);

        List<String> cmd = probe.sshCommand(instance, "nvidia-smi -L");

        assertEquals("ssh", cmd.get(0));
        assertTrue(cmd.contains("BatchMode=yes"));
        assertTrue(cmd.contains("ConnectTimeout=15"));
        assertEquals("2222", cmd.get(cmd.indexOf("-p") + 1));
        assertEquals("/keys/fleet", cmd.get(cmd.indexOf("-i") + 1));
        assertEquals("ubuntu@10.0.0.5", cmd.get(cmd.size() - 2));
        assertEquals("nvidia-smi -L", cmd.get(cmd.size() - 1));
    }

    @Test
    void fallsBackToConfiguredPort() {
        SshWorkerProbe probe = new SshWorkerProbe(cfg, Duration.ofSeconds(10));
        InstanceInfo instance = new InstanceInfo("i-1", "gpu-a", InstanceState.RUNNING, "10.0.0.5", null);

        List<String> cmd = probe.sshCommand(instance, "uptime");

        assertEquals("22", cmd.get(cmd.indexOf("-p") + 1));
        assertFalse(cmd.contains("-i"));
    }

    @Test
    void diagnosticsTailWorkerLog() {
        Map<String, String> commands = new SshWorkerProbe(cfg, Duration.ofSeconds(10)).diagnosticCommands();

        assertEquals(List.of("gpu", "disk", "uptime", "worker_log"), List.copyOf(commands.keySet()));
        assertEquals("tail -n 50 /var/log/gpu-worker.log", commands.get("worker_log"));
    }

    @Test
    void truncateKeepsTail() {
        String longOutput = "x".repeat(SshWorkerProbe.MAX_OUTPUT_CHARS) + "END";

        String truncated = SshWorkerProbe.truncate(longOutput);

        assertEquals(SshWorkerProbe.MAX_OUTPUT_CHARS, truncated.length());
        assertTrue(truncated.endsWith("END"));
        assertEquals("short", SshWorkerProbe.truncate("short"));
    }

    @Test
    void refusesInstanceWithoutAddress() {
        SshWorkerProbe probe = new SshWorkerProbe(cfg, Duration.ofSeconds(10));
        InstanceInfo instance = new InstanceInfo("i-1", "gpu-a", InstanceState.PROVISIONING, null, null);

        assertThrows(ProviderException.class, () -> probe.checkReady(instance));
    }
}
