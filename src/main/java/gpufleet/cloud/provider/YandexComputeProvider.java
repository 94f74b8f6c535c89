package gpufleet.cloud.provider;

import com.google.protobuf.InvalidProtocolBufferException;
import gpufleet.cloud.auth.CloudAuth;
import gpufleet.cloud.config.CloudConfig;
import gpufleet.orchestrator.model.InstanceInfo;
import gpufleet.orchestrator.model.InstanceState;
import gpufleet.orchestrator.provider.ComputeProvider;
import gpufleet.orchestrator.provider.ProviderException;
import gpufleet.orchestrator.provider.SpawnRequest;
import gpufleet.orchestrator.provider.SpawnResult;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import yandex.cloud.api.compute.v1.InstanceOuterClass;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;
import yandex.cloud.api.operation.OperationOuterClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ComputeProvider} backed by Yandex Cloud Compute.
 *
 * Spawn returns once the create operation is accepted; it does not wait for
 * the instance to boot. When a zone has no capacity for a RAM tier the next
 * tier is tried.
 */
public class YandexComputeProvider implements ComputeProvider {

    private static final Logger log = LoggerFactory.getLogger(YandexComputeProvider.class);
    private static final int PAGE_SIZE = 100;

    private final CloudAuth auth;
    private final CloudConfig cfg;

    public YandexComputeProvider(CloudAuth auth, CloudConfig cfg) {
        this.auth = auth;
        this.cfg = cfg;
    }

    @Override
    public SpawnResult spawn(SpawnRequest request) {
        StatusRuntimeException lastCapacityError = null;
        for (int ramGb : request.ramTiersGb()) {
            var req = InstanceSpecBuilder.build(cfg, request.workerId(), ramGb, request.labels());
            try {
                OperationOuterClass.Operation op = auth.instanceService().create(req);
                if (op.hasError()) {
                    if (op.getError().getCode() == Status.Code.RESOURCE_EXHAUSTED.value()) {
                        log.info("No capacity for {} at {}GB, trying next tier", request.workerId(), ramGb);
                        continue;
                    }
                    throw new ProviderException("Create " + request.workerId() + " failed: "
                            + op.getError().getMessage());
                }
                String instanceId = op.getMetadata()
                        .unpack(InstanceServiceOuterClass.CreateInstanceMetadata.class)
                        .getInstanceId();
                log.info("Create sent: name={} id={} ram={}GB", request.workerId(), instanceId, ramGb);
                return new SpawnResult(instanceId, ramGb, cfg.storageVolume());
            } catch (StatusRuntimeException e) {
                if (e.getStatus().getCode() == Status.Code.RESOURCE_EXHAUSTED) {
                    log.info("No capacity for {} at {}GB, trying next tier", request.workerId(), ramGb);
                    lastCapacityError = e;
                    continue;
                }
                throw new ProviderException("Create " + request.workerId() + " failed: " + e.getStatus(), e);
            } catch (InvalidProtocolBufferException e) {
                throw new ProviderException("Unreadable create metadata for " + request.workerId(), e);
            }
        }
        throw new ProviderException("No capacity for " + request.workerId() + " at any RAM tier "
                + request.ramTiersGb(), lastCapacityError);
    }

    @Override
    public Optional<InstanceInfo> getInstance(String instanceId) {
        try {
            InstanceOuterClass.Instance inst = auth.instanceService().get(
                    InstanceServiceOuterClass.GetInstanceRequest.newBuilder()
                            .setInstanceId(instanceId)
                            .build());
            return Optional.of(toInfo(inst));
        } catch (StatusRuntimeException e) {
            if (e.getStatus().getCode() == Status.Code.NOT_FOUND) {
                return Optional.empty();
            }
            throw new ProviderException("Get " + instanceId + " failed: " + e.getStatus(), e);
        }
    }

    @Override
    public void terminate(String instanceId) {
        try {
            auth.instanceService().delete(
                    InstanceServiceOuterClass.DeleteInstanceRequest.newBuilder()
                            .setInstanceId(instanceId)
                            .build());
            log.info("Delete sent: id={}", instanceId);
        } catch (StatusRuntimeException e) {
            if (e.getStatus().getCode() == Status.Code.NOT_FOUND) {
                log.debug("Instance {} already gone", instanceId);
                return;
            }
            throw new ProviderException("Delete " + instanceId + " failed: " + e.getStatus(), e);
        }
    }

    @Override
    public List<InstanceInfo> listInstances(String namePrefix) {
        List<InstanceInfo> result = new ArrayList<>();
        String pageToken = "";
        try {
            do {
                var resp = auth.instanceService().list(
                        InstanceServiceOuterClass.ListInstancesRequest.newBuilder()
                                .setFolderId(cfg.folderId())
                                .setPageSize(PAGE_SIZE)
                                .setPageToken(pageToken)
                                .build());
                for (InstanceOuterClass.Instance inst : resp.getInstancesList()) {
                    if (inst.getName().startsWith(namePrefix)) {
                        result.add(toInfo(inst));
                    }
                }
                pageToken = resp.getNextPageToken();
            } while (!pageToken.isEmpty());
        } catch (StatusRuntimeException e) {
            throw new ProviderException("List instances failed: " + e.getStatus(), e);
        }
        return result;
    }

    private InstanceInfo toInfo(InstanceOuterClass.Instance inst) {
        return new InstanceInfo(inst.getId(), inst.getName(), mapStatus(inst.getStatus()),
                address(inst), cfg.sshPort());
    }

    static InstanceState mapStatus(InstanceOuterClass.Instance.Status status) {
        switch (status) {
            case PROVISIONING:
            case STARTING:
            case RESTARTING:
            case UPDATING:
                return InstanceState.PROVISIONING;
            case RUNNING:
                return InstanceState.RUNNING;
            case ERROR:
            case CRASHED:
                return InstanceState.FAILED;
            // preempted spot instances end up STOPPED
            case STOPPING:
            case STOPPED:
            case DELETING:
                return InstanceState.TERMINATED;
            default:
                return InstanceState.UNKNOWN;
        }
    }

    private String address(InstanceOuterClass.Instance inst) {
        if (inst.getNetworkInterfacesCount() == 0) {
            return null;
        }
        var v4 = inst.getNetworkInterfaces(0).getPrimaryV4Address();
        if (cfg.publicIp() && v4.hasOneToOneNat() && !v4.getOneToOneNat().getAddress().isEmpty()) {
            return v4.getOneToOneNat().getAddress();
        }
        return v4.getAddress().isEmpty() ? null : v4.getAddress();
    }
}
