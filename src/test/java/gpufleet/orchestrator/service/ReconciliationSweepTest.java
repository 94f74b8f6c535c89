package gpufleet.orchestrator.service;

import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.model.InstanceState;
import gpufleet.orchestrator.model.Worker;
import gpufleet.orchestrator.model.WorkerMetadata;
import gpufleet.orchestrator.model.WorkerStatus;
import gpufleet.orchestrator.testing.FakeComputeProvider;
import gpufleet.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationSweepTest {

    private FakeComputeProvider provider;
    private ReconciliationSweep sweep;

    @BeforeEach
    void setup() {
        provider = new FakeComputeProvider();
        sweep = new ReconciliationSweep(provider,
                new WorkerNaming("gpu-", new MutableClock(Instant.parse("2026-01-01T12:00:00Z"))));
    }

    private static Worker worker(String id, WorkerStatus status, String instanceId) {
        WorkerMetadata metadata = instanceId != null
                ? WorkerMetadata.empty().withInstance(instanceId, 48, "vol")
                : WorkerMetadata.empty();
        return Worker.builder().id(id).status(status).createdAt(Instant.EPOCH).metadata(metadata).build();
    }

    @Test
    void terminatesInstanceNoWorkerClaims() {
        provider.putRunning("inst-1", "gpu-w1");
        provider.putRunning("inst-orphan", "gpu-20260101-100000-deadbeef");

        ReconciliationResult result = sweep.sweep(List.of(worker("gpu-w1", WorkerStatus.ACTIVE, "inst-1")));

        assertTrue(result.performed());
        assertEquals(1, result.orphanedInstancesTerminated());
        assertEquals(List.of("inst-orphan"), provider.terminated());
        assertTrue(result.externallyTerminated().isEmpty());
    }

    @Test
    void instanceOfTerminatedWorkerIsOrphaned() {
        provider.putRunning("inst-1", "gpu-w1");

        ReconciliationResult result = sweep.sweep(List.of(worker("gpu-w1", WorkerStatus.TERMINATED, "inst-1")));

        assertEquals(1, result.orphanedInstancesTerminated());
    }

    @Test
    void instanceClaimedByNameBeforeIdIsRecorded() {
        // registered, spawn call in flight: row has no instance id yet
        provider.putRunning("inst-1", "gpu-w1");

        ReconciliationResult result = sweep.sweep(List.of(worker("gpu-w1", WorkerStatus.INACTIVE, null)));

        assertEquals(0, result.orphanedInstancesTerminated());
        assertTrue(provider.terminated().isEmpty());
    }

    @Test
    void reportsLiveWorkerWhoseInstanceIsGone() {
        provider.put(new InstanceInfo("inst-2", "gpu-w2", InstanceState.TERMINATED, null, null));
        Worker active = worker("gpu-w1", WorkerStatus.ACTIVE, "inst-1");
        Worker spawning = worker("gpu-w2", WorkerStatus.SPAWNING, "inst-2");

        ReconciliationResult result = sweep.sweep(List.of(active, spawning));

        assertEquals(List.of(active, spawning), result.externallyTerminated());
        assertEquals(0, result.orphanedInstancesTerminated());
    }

    @Test
    void listingFailureSkipsSweep() {
        provider.putRunning("inst-orphan", "gpu-orphan");
        provider.failList = true;

        ReconciliationResult result = sweep.sweep(List.of(worker("gpu-w1", WorkerStatus.ACTIVE, "inst-1")));

        assertFalse(result.performed());
        assertTrue(result.externallyTerminated().isEmpty());
        assertTrue(provider.terminated().isEmpty());
    }

    @Test
    void failedOrphanTerminationIsCounted() {
        provider.putRunning("inst-orphan", "gpu-orphan");
        provider.failTerminate = true;

        ReconciliationResult result = sweep.sweep(List.of());

        assertEquals(0, result.orphanedInstancesTerminated());
        assertEquals(1, result.remoteCallFailures());
    }
}
