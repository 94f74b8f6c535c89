package gpufleet.orchestrator.service;

import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.provider.ComputeProvider;
import gpufleet.orchestrator.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cross-checks the provider's instances against the worker rows.
 * <ul>
 * <li>forward: a live instance that no non-terminated worker claims (by name or
 * instance id) is deleted</li>
 * <li>reverse: a SPAWNING/ACTIVE worker whose instance is not in the live listing
 * is reported back so the caller can fail it</li>
 * </ul>
 * Nothing is decided when the listing itself fails.
 */
public class ReconciliationSweep {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationSweep.class);

    private final ComputeProvider provider;
    private final WorkerNaming naming;

    public ReconciliationSweep(ComputeProvider provider, WorkerNaming naming) {
        this.provider = provider;
        this.naming = naming;
    }

    public ReconciliationResult sweep(List<Worker> workers) {
        List<InstanceInfo> instances;
        try {
            instances = provider.listInstances(naming.prefix());
        } catch (ProviderException e) {
            log.warn("Reconciliation skipped, instance listing failed: {}", e.getMessage());
            return ReconciliationResult.skipped();
        }

        Set<String> knownNames = new HashSet<>();
        Set<String> knownInstanceIds = new HashSet<>();
        for (Worker worker : workers) {
            if (worker.status() == WorkerStatus.TERMINATED) {
                continue;
            }
            knownNames.add(worker.id());
            if (worker.metadata().hasInstance()) {
                knownInstanceIds.add(worker.instanceId());
            }
        }

        Set<String> liveInstanceIds = new HashSet<>();
        int orphansTerminated = 0;
        int failures = 0;

        for (InstanceInfo instance : instances) {
            if (!instance.state().isLive() || !naming.isOurs(instance.name())) {
                continue;
            }
            liveInstanceIds.add(instance.instanceId());

            boolean claimed = knownInstanceIds.contains(instance.instanceId())
                    || (instance.name() != null && knownNames.contains(instance.name()));
            if (claimed) {
                continue;
            }

            try {
                provider.terminate(instance.instanceId());
                orphansTerminated++;
                log.warn("Terminated orphaned instance {} ({}), no worker row claims it",
                        instance.instanceId(), instance.name());
            } catch (ProviderException e) {
                failures++;
                log.warn("Failed to terminate orphaned instance {}: {}", instance.instanceId(), e.getMessage());
            }
        }

        List<Worker> missing = new ArrayList<>();
        for (Worker worker : workers) {
            WorkerStatus status = worker.effectiveStatus();
            if (!status.isLive() || !worker.metadata().hasInstance()) {
                continue;
            }
            if (!liveInstanceIds.contains(worker.instanceId())) {
                missing.add(worker);
                log.warn("Worker {} is {} but instance {} is not live at the provider",
                        worker.id(), status, worker.instanceId());
            }
        }

        log.info("Reconciliation: {} instances listed, {} orphaned terminated, {} workers externally terminated",
                instances.size(), orphansTerminated, missing.size());
        return new ReconciliationResult(true, orphansTerminated, missing, failures);
    }
}
