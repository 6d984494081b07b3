package com.platform.paas.admission;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Desired shape of one workload: its containers' resources and its volumes.
 */
public record WorkloadDescriptor(
    @NotBlank String appId,
    @NotBlank String name,
    @Min(0) Integer replicas,
    @Valid List<ContainerResources> containers,
    @Valid List<VolumeRequest> volumes
) {
    
    public WorkloadDescriptor {
        containers = containers == null ? List.of() : List.copyOf(containers);
        volumes = volumes == null ? List.of() : List.copyOf(volumes);
    }
    
    public int replicaCount() {
        return replicas == null ? 1 : replicas;
    }
    
    public WorkloadDescriptor withResources(List<ContainerResources> newContainers, List<VolumeRequest> newVolumes) {
        return new WorkloadDescriptor(appId, name, replicas, newContainers, newVolumes);
    }
}
