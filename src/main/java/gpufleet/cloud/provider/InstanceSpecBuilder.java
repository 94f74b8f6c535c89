package gpufleet.cloud.provider;

import gpufleet.cloud.config.CloudConfig;
import yandex.cloud.api.compute.v1.InstanceOuterClass;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;

import java.util.Map;

/**
 * Builds the create request for one GPU worker at a given RAM tier.
 */
public final class InstanceSpecBuilder {

    private static final long GB = 1024L * 1024 * 1024;

    private InstanceSpecBuilder() {
    }

    public static InstanceServiceOuterClass.CreateInstanceRequest build(
            CloudConfig cfg, String name, int ramGb, Map<String, String> labels) {

        var resources = InstanceServiceOuterClass.ResourcesSpec.newBuilder()
                .setCores(cfg.cpu())
                .setMemory(ramGb * GB)
                .setGpus(cfg.gpus())
                .build();

        var disk = InstanceServiceOuterClass.AttachedDiskSpec.DiskSpec.newBuilder()
                .setImageId(cfg.imageId())
                .setTypeId(cfg.diskType())
                .setSize(cfg.diskGb() * GB)
                .build();

        var boot = InstanceServiceOuterClass.AttachedDiskSpec.newBuilder()
                .setAutoDelete(true)
                .setDiskSpec(disk)
                .build();

        var nic = InstanceServiceOuterClass.NetworkInterfaceSpec.newBuilder()
                .setSubnetId(cfg.subnetId());
        if (cfg.securityGroupId() != null && !cfg.securityGroupId().isBlank()) {
            nic.addSecurityGroupIds(cfg.securityGroupId());
        }

        var addr = InstanceServiceOuterClass.PrimaryAddressSpec.newBuilder();
        if (cfg.publicIp()) {
            addr.setOneToOneNatSpec(
                    InstanceServiceOuterClass.OneToOneNatSpec.newBuilder()
                            .setIpVersion(InstanceOuterClass.IpVersion.IPV4)
                            .build()
            );
        }
        nic.setPrimaryV4AddressSpec(addr.build());

        return InstanceServiceOuterClass.CreateInstanceRequest.newBuilder()
                .setFolderId(cfg.folderId())
                .setName(name)
                .setHostname(name)
                .setZoneId(cfg.zoneId())
                .setPlatformId(cfg.platformId())
                .setResourcesSpec(resources)
                .setBootDiskSpec(boot)
                .addNetworkInterfaceSpecs(nic)
                .putAllLabels(labels)
                .putMetadata("user-data", userData(cfg, name))
                .setSchedulingPolicy(
                        InstanceOuterClass.SchedulingPolicy.newBuilder()
                                .setPreemptible(cfg.preemptible())
                                .build()
                )
                .build();
    }

    /**
     * cloud-init: login user with the configured key plus the worker id file
     * the worker agent reads on boot.
     */
    static String userData(CloudConfig cfg, String workerId) {
        return """
            #cloud-config
            ssh_pwauth: no
            users:
              - name: %s
                sudo: ALL=(ALL) NOPASSWD:ALL
                shell: /bin/bash
                ssh_authorized_keys:
                  - %s
            write_files:
              - path: /etc/gpufleet/worker-id
                content: |
                  %s
            """.formatted(cfg.sshUser(), cfg.sshPublicKey(), workerId);
    }
}
