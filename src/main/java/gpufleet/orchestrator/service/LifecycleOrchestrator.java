package gpufleet.orchestrator.service;

import gpufleet.orchestrator.config.OrchestratorConfig;
import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.model.Task;
import gpufleet.orchestrator.model.TaskCounts;
import gpufleet.orchestrator.model.TerminationReason;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerDiagnostics;
import gpufleet.orchestrator.model.WorkerMetadata;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.provider.ComputeProvider;
import gpufleet.orchestrator.provider.ProviderException;
import gpufleet.orchestrator.provider.SpawnRequest;
import gpufleet.orchestrator.provider.SpawnResult;
import gpufleet.orchestrator.provider.WorkerProbe;
import gpufleet.orchestrator.repository.TaskRepository;
import gpufleet.orchestrator.repository.WorkerRepository;
import gpufleet.orchestrator.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The control loop. One call to {@link #runCycle()} performs, in this order:
 * <ol>
 * <li>fetch workers and workload, classify by lifecycle stage</li>
 * <li>cancel surplus spawning workers (only with an empty queue, outside the cooldown)</li>
 * <li>resolve spawning workers: promote, fail or keep waiting</li>
 * <li>health-check active workers; finish leftover ERROR rows</li>
 * <li>batch orphaned-task recovery over recently failed workers</li>
 * <li>recompute the desired size from counts adjusted by steps 3-5</li>
 * <li>scale down idle surplus, oldest idle first, keeping the idle buffer</li>
 * <li>scale up to the deficit unless the failure-rate breaker is open</li>
 * <li>every Nth cycle, reconcile provider instances with worker rows</li>
 * </ol>
 * Not thread-safe: cycles must not overlap.
 */
public class LifecycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LifecycleOrchestrator.class);
    private static final int SPAWN_ANOMALY_THRESHOLD = 3;

    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;
    private final ComputeProvider provider;
    private final WorkerProbe probe;
    private final OrchestratorConfig config;
    private final Clock clock;

    private final ScalingDecisionEngine scaling;
    private final HealthEvaluator health;
    private final FailureRateBreaker breaker;
    private final OrphanedTaskRecovery recovery;
    private final ReconciliationSweep reconciliation;
    private final WorkerNaming naming;
    private final OrchestratorContext context = new OrchestratorContext();

    public LifecycleOrchestrator(WorkerRepository workerRepository, TaskRepository taskRepository,
            ComputeProvider provider, WorkerProbe probe, OrchestratorConfig config, Clock clock) {
        this.workerRepository = workerRepository;
        this.taskRepository = taskRepository;
        this.provider = provider;
        this.probe = probe;
        this.config = config;
        this.clock = clock;

        TaskTypeClassifier classifier = new TaskTypeClassifier(config.longRunningTaskTypes());
        this.scaling = new ScalingDecisionEngine(config);
        this.health = new HealthEvaluator(config, classifier, clock);
        this.breaker = new FailureRateBreaker(workerRepository, config, clock);
        this.recovery = new OrphanedTaskRecovery(taskRepository, classifier, config, clock);
        this.naming = new WorkerNaming(config.workerNamePrefix(), clock);
        this.reconciliation = new ReconciliationSweep(provider, naming);
    }

    public OrchestratorContext context() {
        return context;
    }

    /**
     * Run one full cycle. Never throws: a cycle-level failure is reported in
     * the summary's {@code error} field.
     */
    public CycleSummary runCycle() {
        long cycle = context.nextCycle();
        Instant started = clock.instant();
        CycleTally tally = new CycleTally();
        MDC.put("cycle", String.valueOf(cycle));

        CycleSummary summary;
        try {
            runSteps(cycle, started, tally);
            summary = tally.toSummary(cycle, started, clock.instant(), scaling.idleBufferTarget(), null);
        } catch (StoreException e) {
            log.error("Cycle {} aborted, state store unavailable", cycle, e);
            summary = tally.toSummary(cycle, started, clock.instant(), scaling.idleBufferTarget(),
                    "state store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Cycle {} failed", cycle, e);
            summary = tally.toSummary(cycle, started, clock.instant(), scaling.idleBufferTarget(), e.toString());
        } finally {
            MDC.remove("cycle");
        }

        context.recordSummary(summary);
        log.info("Cycle {} done: promoted={} failed={} spawned={} terminated={} tasksReset={} desired={} error={}",
                cycle, tally.promoted, tally.failed, tally.spawned, tally.terminated, tally.tasksReset,
                tally.decision.desired(), summary.error());
        return summary;
    }

    private void runSteps(long cycle, Instant now, CycleTally tally) {
        // 1. classify
        List<Worker> all = workerRepository.findAll();
        TaskCounts counts = taskRepository.countWorkload();

        List<Worker> spawning = new ArrayList<>();
        List<Worker> active = new ArrayList<>();
        List<Worker> errored = new ArrayList<>();
        for (Worker worker : all) {
            switch (worker.effectiveStatus()) {
                case INACTIVE, SPAWNING -> spawning.add(worker);
                case ACTIVE -> active.add(worker);
                case ERROR -> errored.add(worker);
                case TERMINATED -> {
                }
            }
        }
        log.info("Fleet: {} spawning, {} active, {} error; tasks: {} queued, {} in progress",
                spawning.size(), active.size(), errored.size(), counts.queued(), counts.inProgress());

        // 2. early termination of surplus spawning workers
        cancelSurplusSpawning(spawning, active.size(), counts, now, tally);

        // 3. resolve spawning workers
        List<Worker> stillSpawning = new ArrayList<>();
        for (Worker worker : spawning) {
            try {
                resolveSpawning(worker, active, stillSpawning, tally);
            } catch (StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error resolving spawning worker {}", worker.id(), e);
                stillSpawning.add(worker);
            }
        }

        // 4. health-check active workers
        Map<String, Worker> healthy = new LinkedHashMap<>();
        List<HealthVerdict> idle = new ArrayList<>();
        List<HealthVerdict> candidates = new ArrayList<>();
        int busy = 0;
        int activeCount = active.size();
        for (Worker worker : active) {
            try {
                CheckedWorker checked = checkActive(worker, counts.queued(), activeCount, tally);
                if (checked == null) {
                    activeCount--;
                    continue;
                }
                healthy.put(worker.id(), worker);
                if (checked.busy()) {
                    busy++;
                } else {
                    idle.add(checked.verdict());
                    if (checked.verdict().verdict() == Verdict.ELIGIBLE_FOR_TERMINATION) {
                        candidates.add(checked.verdict());
                    }
                }
            } catch (StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error checking worker {}", worker.id(), e);
                healthy.put(worker.id(), worker);
                busy++;
            }
        }
        for (Worker worker : errored) {
            try {
                String reason = worker.metadata().errorReason() != null
                        ? worker.metadata().errorReason()
                        : "found in ERROR";
                failWorker(worker, reason, null, TerminationReason.FAILED, tally);
            } catch (StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error finishing ERROR worker {}", worker.id(), e);
            }
        }

        // 5. batch orphan recovery
        recoverOrphans(now, tally);

        // 6. desired size from adjusted counts
        TaskCounts adjusted = taskRepository.countWorkload();
        ScalingDecision decision = scaling.decide(adjusted.queued(), adjusted.inProgress(), idle.size(), busy);
        tally.decision = decision;
        tally.queued = adjusted.queued();
        tally.inProgress = adjusted.inProgress();
        warnOnWorkloadJump(adjusted.total());

        // 7. scale down
        int terminated = scaleDown(healthy, idle.size(), stillSpawning.size(), candidates, decision, now, tally);

        // 8. scale up
        tally.breaker = breaker.evaluate();
        int current = healthy.size() - terminated + stillSpawning.size();
        int deficit = decision.desired() - current;
        if (deficit > 0) {
            if (tally.breaker.blocked()) {
                log.error("Scale-up of {} worker(s) blocked by failure-rate breaker: {}",
                        deficit, tally.breaker.reason());
            } else {
                scaleUp(deficit, now, tally);
            }
        }

        tally.active = healthy.size() - terminated;
        tally.spawning = stillSpawning.size() + tally.spawned;
        tally.idle = Math.max(0, idle.size() - terminated);
        tally.busy = busy;

        // 9. reconciliation
        if (cycle % config.reconciliationCycleStride() == 0) {
            reconcile(tally);
        }
    }

    // ---------- step 2 ----------

    private void cancelSurplusSpawning(List<Worker> spawning, int activeCount, TaskCounts counts, Instant now,
            CycleTally tally) {
        int capacity = activeCount + spawning.size();
        int target = scaling.earlyTerminationTarget(counts.queued(), counts.inProgress());
        if (capacity <= target || spawning.isEmpty()) {
            return;
        }
        if (counts.queued() > 0) {
            log.debug("Skipping early termination, {} task(s) queued", counts.queued());
            return;
        }
        if (context.inScaleDownCooldown(now, config.scaleDownCooldown())) {
            log.debug("Skipping early termination, within scale-down cooldown");
            return;
        }

        Duration grace = config.spawnGracePeriod();
        List<Worker> eligible = spawning.stream()
                .filter(w -> w.age(now).compareTo(grace) > 0)
                .sorted(Comparator.comparing(Worker::createdAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        int toCancel = Math.min(capacity - target, eligible.size());
        if (toCancel <= 0) {
            return;
        }

        log.info("Early termination: capacity {} > target {}, cancelling {} spawning worker(s)",
                capacity, target, toCancel);
        int cancelled = 0;
        for (Worker worker : eligible.subList(0, toCancel)) {
            try {
                if (terminateVoluntarily(worker, TerminationReason.SPAWN_CANCELLED, tally)) {
                    spawning.remove(worker);
                    cancelled++;
                }
            } catch (StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error cancelling spawning worker {}", worker.id(), e);
            }
        }
        if (cancelled > 0) {
            context.recordScaleDown(now);
        }
    }

    // ---------- step 3 ----------

    private void resolveSpawning(Worker worker, List<Worker> active, List<Worker> stillSpawning, CycleTally tally) {
        InstanceInfo instance = lookupInstance(worker, tally);
        boolean ready = false;
        if (instance != null && instance.isRunning()) {
            try {
                ready = probe.checkReady(instance);
            } catch (ProviderException e) {
                tally.remoteFailures++;
                log.warn("Readiness check failed for worker {}: {}", worker.id(), e.getMessage());
            }
        }

        HealthVerdict verdict = health.evaluateSpawning(worker, instance, ready);
        switch (verdict.verdict()) {
            case READY -> {
                Optional<Worker> promoted = promote(worker, instance);
                if (promoted.isPresent()) {
                    active.add(promoted.get());
                    tally.promoted++;
                } else {
                    stillSpawning.add(worker);
                }
            }
            case DEAD, STUCK -> {
                if (failWorker(worker, verdict.reason(), instance, TerminationReason.FAILED, tally)) {
                    tally.failed++;
                }
            }
            default -> stillSpawning.add(worker);
        }
    }

    private Optional<Worker> promote(Worker worker, InstanceInfo instance) {
        WorkerMetadata metadata = worker.metadata()
                .withEndpoint(instance.host(), instance.sshPort())
                .withPromotion(clock.instant());
        Optional<Worker> promoted = workerRepository.update(worker, WorkerStatus.ACTIVE, metadata);
        promoted.ifPresent(w -> log.info("Worker {} promoted to ACTIVE ({}:{})",
                w.id(), instance.host(), instance.sshPort()));
        return promoted;
    }

    // ---------- step 4 ----------

    private record CheckedWorker(HealthVerdict verdict, boolean busy) {
    }

    /**
     * @return the verdict for a surviving worker, or null if it was failed
     */
    private CheckedWorker checkActive(Worker worker, int queued, int activeCount, CycleTally tally) {
        List<Task> tasks = taskRepository.findInProgressByWorker(worker.id());
        InstanceInfo instance = lookupInstance(worker, tally);
        Instant lastCompletion = taskRepository.lastCompletionAt(worker.id()).orElse(null);

        HealthVerdict verdict = health.evaluateActive(worker,
                new ActiveWorkerState(tasks, instance, lastCompletion, queued, activeCount));

        if (verdict.isDead()) {
            log.warn("Worker {} is {}: {}", worker.id(), verdict.verdict(), verdict.reason());
            if (failWorker(worker, verdict.reason(), instance, TerminationReason.FAILED, tally)) {
                tally.failed++;
            }
            return null;
        }
        log.debug("Worker {}: {} ({})", worker.id(), verdict.verdict(), verdict.reason());
        return new CheckedWorker(verdict, !tasks.isEmpty());
    }

    // ---------- step 5 ----------

    private void recoverOrphans(Instant now, CycleTally tally) {
        Instant since = now.minus(config.recentFailureLookback());
        Set<String> recentlyFailed = workerRepository.findUpdatedSince(since).stream()
                .filter(w -> w.status() == WorkerStatus.ERROR || w.status() == WorkerStatus.TERMINATED)
                .map(Worker::id)
                .collect(Collectors.toSet());

        RecoveryResult result = recovery.recoverForWorkers(recentlyFailed, "owning worker no longer alive")
                .plus(recovery.recoverUnassigned());
        tally.add(result);
    }

    // ---------- step 7 ----------

    private int scaleDown(Map<String, Worker> healthy, int idleCount, int spawningCount,
            List<HealthVerdict> candidates, ScalingDecision decision, Instant now, CycleTally tally) {
        if (candidates.isEmpty()) {
            return 0;
        }
        int excess = healthy.size() + spawningCount - decision.desired();
        int aboveBuffer = idleCount - scaling.idleBufferTarget();
        // spawning workers may still fail, so they never stand in for the active floor
        int aboveFloor = healthy.size() - config.minWorkers();
        int limit = Math.min(Math.min(candidates.size(), aboveFloor), Math.min(excess, aboveBuffer));
        if (limit <= 0) {
            return 0;
        }

        List<HealthVerdict> oldestIdleFirst = candidates.stream()
                .sorted(Comparator.comparing(HealthVerdict::idleSince, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();

        int terminated = 0;
        for (HealthVerdict candidate : oldestIdleFirst) {
            if (terminated >= limit) {
                break;
            }
            Worker worker = healthy.get(candidate.workerId());
            try {
                if (!taskRepository.findInProgressByWorker(worker.id()).isEmpty()) {
                    log.info("Worker {} picked up work, not scaling it down", worker.id());
                    continue;
                }
                if (terminateVoluntarily(worker, TerminationReason.SCALED_DOWN, tally)) {
                    terminated++;
                    log.info("Scaled down idle worker {} ({})", worker.id(), candidate.reason());
                }
            } catch (StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error scaling down worker {}", worker.id(), e);
            }
        }
        if (terminated > 0) {
            context.recordScaleDown(now);
        }
        return terminated;
    }

    // ---------- step 8 ----------

    private void scaleUp(int deficit, Instant now, CycleTally tally) {
        log.info("Scaling up by {} worker(s)", deficit);
        for (int i = 0; i < deficit; i++) {
            try {
                if (spawnWorker(tally)) {
                    tally.spawned++;
                }
            } catch (StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error spawning worker", e);
            }
        }
        if (tally.spawned > 0) {
            context.recordScaleUp(now);
        }
        if (tally.spawned >= SPAWN_ANOMALY_THRESHOLD) {
            log.warn("Scaling anomaly: {} workers spawned in one cycle", tally.spawned);
        }
    }

    /**
     * Register the worker row first, then request the instance, then record it.
     * An instance that cannot be recorded is deleted at once.
     */
    private boolean spawnWorker(CycleTally tally) {
        String workerId = naming.newWorkerId();
        Worker registered = workerRepository.insert(Worker.builder()
                .id(workerId)
                .createdAt(clock.instant())
                .metadata(WorkerMetadata.empty().withOrchestratorStatus(WorkerStatus.SPAWNING))
                .build());

        SpawnResult result;
        try {
            result = provider.spawn(new SpawnRequest(workerId, config.ramTiersGb(),
                    Map.of("managed-by", "gpufleet", "worker-id", workerId)));
        } catch (ProviderException e) {
            tally.remoteFailures++;
            log.warn("Spawn of worker {} failed: {}", workerId, e.getMessage());
            if (failWorker(registered, "spawn failed: " + e.getMessage(), null, TerminationReason.FAILED, tally)) {
                tally.failed++;
            }
            return false;
        }

        WorkerMetadata metadata = registered.metadata()
                .withInstance(result.instanceId(), result.ramTierGb(), result.storageVolume())
                .withOrchestratorStatus(WorkerStatus.SPAWNING);
        Optional<Worker> recorded;
        try {
            recorded = workerRepository.update(registered, WorkerStatus.SPAWNING, metadata);
        } catch (StoreException e) {
            log.error("Could not record instance {} for worker {}, terminating it", result.instanceId(), workerId);
            terminateInstance(result.instanceId(), tally);
            throw e;
        }
        if (recorded.isEmpty()) {
            log.error("Worker {} changed before instance {} was recorded, terminating it",
                    workerId, result.instanceId());
            terminateInstance(result.instanceId(), tally);
            return false;
        }

        log.info("Spawned worker {} (instance {}, {} GB)", workerId, result.instanceId(), result.ramTierGb());
        return true;
    }

    // ---------- step 9 ----------

    private void reconcile(CycleTally tally) {
        ReconciliationResult result = reconciliation.sweep(workerRepository.findAll());
        tally.reconciled = result.performed();
        tally.orphanedInstances += result.orphanedInstancesTerminated();
        tally.remoteFailures += result.remoteCallFailures();

        for (Worker worker : result.externallyTerminated()) {
            try {
                if (failWorker(worker, "externally terminated", InstanceInfo.missing(worker.instanceId()),
                        TerminationReason.EXTERNALLY_TERMINATED, tally)) {
                    tally.failed++;
                }
            } catch (StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error failing externally terminated worker {}", worker.id(), e);
            }
        }
    }

    // ---------- transitions ----------

    /**
     * ERROR then TERMINATED: diagnostics written once, orphaned tasks re-queued,
     * instance deletion requested (best effort). A TERMINATED worker is left as is.
     *
     * @return true if this call moved the worker into ERROR
     */
    boolean failWorker(Worker worker, String reason, InstanceInfo instance, TerminationReason finalReason,
            CycleTally tally) {
        if (worker.status() == WorkerStatus.TERMINATED) {
            return false;
        }

        Worker current = worker;
        boolean newlyFailed = false;
        if (current.status() != WorkerStatus.ERROR) {
            List<Task> running = taskRepository.findInProgressByWorker(current.id());
            WorkerDiagnostics diagnostics = collectDiagnostics(current, reason, instance, running, tally);
            Optional<Worker> errored = workerRepository.update(current, WorkerStatus.ERROR,
                    current.metadata().withError(reason, clock.instant(), diagnostics));
            if (errored.isEmpty()) {
                log.warn("Worker {} changed concurrently, ERROR transition deferred", current.id());
                return false;
            }
            current = errored.get();
            newlyFailed = true;
            log.warn("Worker {} -> ERROR: {}", current.id(), reason);
        }

        tally.add(recovery.recoverForWorkers(List.of(current.id()), "worker " + current.id() + " failed: " + reason));

        if (current.metadata().hasInstance()) {
            terminateInstance(current.instanceId(), tally);
        }

        Optional<Worker> done = workerRepository.update(current, WorkerStatus.TERMINATED,
                current.metadata().withTermination(finalReason, clock.instant()));
        if (done.isPresent()) {
            log.info("Worker {} -> TERMINATED ({})", current.id(), finalReason);
        } else {
            log.warn("Worker {} changed concurrently, TERMINATED transition deferred", current.id());
        }
        return newlyFailed;
    }

    private boolean terminateVoluntarily(Worker worker, TerminationReason reason, CycleTally tally) {
        if (worker.metadata().hasInstance()) {
            terminateInstance(worker.instanceId(), tally);
        }
        Optional<Worker> done = workerRepository.update(worker, WorkerStatus.TERMINATED,
                worker.metadata().withTermination(reason, clock.instant()));
        if (done.isPresent()) {
            tally.terminated++;
            log.info("Worker {} -> TERMINATED ({})", worker.id(), reason);
            return true;
        }
        log.warn("Worker {} changed concurrently, {} skipped", worker.id(), reason);
        return false;
    }

    private WorkerDiagnostics collectDiagnostics(Worker worker, String reason, InstanceInfo instance,
            List<Task> running, CycleTally tally) {
        Instant now = clock.instant();
        Map<String, String> probeOutput = null;
        String probeError = null;
        if (instance != null && instance.isRunning() && instance.hasEndpoint()) {
            try {
                probeOutput = probe.runDiagnosticProbe(instance);
            } catch (ProviderException e) {
                tally.remoteFailures++;
                probeError = e.getMessage();
                log.warn("Diagnostic probe failed for worker {}: {}", worker.id(), e.getMessage());
            }
        }
        return new WorkerDiagnostics(
                now,
                reason,
                worker.lastHeartbeat(),
                worker.lastHeartbeat() != null ? Duration.between(worker.lastHeartbeat(), now).toSeconds() : null,
                worker.instanceId(),
                instance != null ? instance.state().name() : null,
                running.stream().map(Task::id).toList(),
                probeOutput,
                probeError);
    }

    // ---------- provider helpers ----------

    /**
     * @return provider view, {@link InstanceInfo#missing} if the provider does not
     *         know the id, null if there is no id or the call failed
     */
    private InstanceInfo lookupInstance(Worker worker, CycleTally tally) {
        if (!worker.metadata().hasInstance()) {
            return null;
        }
        try {
            return provider.getInstance(worker.instanceId())
                    .orElse(InstanceInfo.missing(worker.instanceId()));
        } catch (ProviderException e) {
            tally.remoteFailures++;
            log.warn("Instance lookup failed for worker {}: {}", worker.id(), e.getMessage());
            return null;
        }
    }

    private void terminateInstance(String instanceId, CycleTally tally) {
        try {
            provider.terminate(instanceId);
        } catch (ProviderException e) {
            tally.remoteFailures++;
            log.warn("Terminate request for instance {} failed, reconciliation will retry: {}",
                    instanceId, e.getMessage());
        }
    }

    private void warnOnWorkloadJump(int workload) {
        int previous = context.recordWorkload(workload);
        if (previous > 0 && workload >= previous * 10) {
            log.warn("Scaling anomaly: workload jumped from {} to {}", previous, workload);
        }
    }
}
