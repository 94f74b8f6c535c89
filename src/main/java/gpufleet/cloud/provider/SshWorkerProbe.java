package gpufleet.cloud.provider;

import gpufleet.cloud.config.CloudConfig;
import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.provider.ProviderException;
import gpufleet.orchestrator.provider.WorkerProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link WorkerProbe} that runs commands on the worker through the local
 * {@code ssh} client.
 */
public class SshWorkerProbe implements WorkerProbe {

    private static final Logger log = LoggerFactory.getLogger(SshWorkerProbe.class);

    /** ssh exits with 255 when the connection itself failed. */
    static final int SSH_TRANSPORT_FAILURE = 255;
    static final int MAX_OUTPUT_CHARS = 4000;

    static final String READY_COMMAND = "nvidia-smi -L";

    private final CloudConfig cfg;
    private final Duration timeout;

    public SshWorkerProbe(CloudConfig cfg, Duration timeout) {
        this.cfg = cfg;
        this.timeout = timeout;
    }

    @Override
    public boolean checkReady(InstanceInfo instance) {
        requireEndpoint(instance);
        CommandResult r = run(instance, READY_COMMAND);
        if (r.exitCode() != 0) {
            log.debug("Worker {} not ready (exit {}): {}", instance.name(), r.exitCode(), r.output());
            return false;
        }
        return r.output().contains("GPU");
    }

    @Override
    public Map<String, String> runDiagnosticProbe(InstanceInfo instance) {
        requireEndpoint(instance);
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : diagnosticCommands().entrySet()) {
            CommandResult r = run(instance, e.getValue());
            out.put(e.getKey(), r.exitCode() == 0 ? r.output() : "exit " + r.exitCode() + ": " + r.output());
        }
        return out;
    }

    Map<String, String> diagnosticCommands() {
        Map<String, String> commands = new LinkedHashMap<>();
        commands.put("gpu", "nvidia-smi");
        commands.put("disk", "df -h");
        commands.put("uptime", "uptime");
        commands.put("worker_log", "tail -n 50 " + cfg.workerLogPath());
        return commands;
    }

    List<String> sshCommand(InstanceInfo instance, String remoteCommand) {
        List<String> cmd = new ArrayList<>(List.of(
                "ssh",
                "-o", "BatchMode=yes",
                "-o", "StrictHostKeyChecking=no",
                "-o", "UserKnownHostsFile=/dev/null",
                "-o", "ConnectTimeout=" + Math.max(1, timeout.toSeconds()),
                "-p", String.valueOf(instance.sshPort() != null ? instance.sshPort() : cfg.sshPort())));
        if (cfg.sshPrivateKeyPath() != null && !cfg.sshPrivateKeyPath().isBlank()) {
            cmd.add("-i");
            cmd.add(cfg.sshPrivateKeyPath());
        }
        cmd.add(cfg.sshUser() + "@" + instance.host());
        cmd.add(remoteCommand);
        return cmd;
    }

    private CommandResult run(InstanceInfo instance, String remoteCommand) {
        Path outFile = null;
        try {
            outFile = Files.createTempFile("gpufleet-ssh", ".out");
            Process p = new ProcessBuilder(sshCommand(instance, remoteCommand))
                    .redirectErrorStream(true)
                    .redirectOutput(outFile.toFile())
                    .start();
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new ProviderException("ssh '" + remoteCommand + "' on " + instance.host()
                        + " timed out after " + timeout.toSeconds() + "s");
            }
            String output = truncate(Files.readString(outFile, StandardCharsets.UTF_8).trim());
            if (p.exitValue() == SSH_TRANSPORT_FAILURE) {
                throw new ProviderException("ssh to " + instance.host() + " failed: " + output);
            }
            return new CommandResult(p.exitValue(), output);
        } catch (IOException e) {
            throw new ProviderException("ssh '" + remoteCommand + "' on " + instance.host() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while probing " + instance.host(), e);
        } finally {
            if (outFile != null) {
                try {
                    Files.deleteIfExists(outFile);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", outFile, e.getMessage());
                }
            }
        }
    }

    private static void requireEndpoint(InstanceInfo instance) {
        if (!instance.hasEndpoint()) {
            throw new ProviderException("Instance " + instance.instanceId() + " has no address yet");
        }
    }

    static String truncate(String s) {
        return s.length() <= MAX_OUTPUT_CHARS ? s : s.substring(s.length() - MAX_OUTPUT_CHARS);
    }

    record CommandResult(int exitCode, String output) {
    }
}
