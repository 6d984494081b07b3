package com.platform.paas.reconciliation;

import com.platform.paas.admission.VolumeRequest;
import com.platform.paas.connectors.kubernetes.ClusterClient;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.reconciliation.manifest.WorkloadManifestBuilder;
import com.platform.paas.worker.TaskContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converges the cluster toward the desired workloads in the task's scope.
 * 
 * Per workload: namespace, secret, one claim per volume, then the deployment.
 * All writes are server-side applies, so a repeated run changes nothing.
 */
@Slf4j
@Component
public class SyncStateHandler extends AbstractTaskHandler {
    
    private final DesiredStateRepository desiredState;
    private final WorkloadManifestBuilder manifests;
    private final ClusterClient cluster;
    
    public SyncStateHandler(
            DesiredStateRepository desiredState,
            WorkloadManifestBuilder manifests,
            ClusterClient cluster) {
        this.desiredState = desiredState;
        this.manifests = manifests;
        this.cluster = cluster;
    }
    
    @Override
    public TaskKind kind() {
        return TaskKind.SYNC_STATE;
    }
    
    @Override
    public void handle(ReconciliationTask task, TaskContext context) {
        List<DesiredWorkload> workloads = store(() -> desiredState.workloads(task.scope()));
        Set<String> namespaces = new HashSet<>();
        
        for (DesiredWorkload desired : workloads) {
            String namespace = desired.namespace();
            if (namespaces.add(namespace)) {
                context.checkpoint();
                cluster(() -> cluster.ensureNamespace(namespace, manifests.namespaceLabels(desired)));
            }
            
            context.checkpoint();
            cluster(() -> cluster.applySecret(namespace, manifests.secret(desired)));
            
            for (VolumeRequest volume : desired.workload().volumes()) {
                context.checkpoint();
                cluster(() -> cluster.applyPersistentVolumeClaim(namespace, manifests.persistentVolumeClaim(desired, volume)));
            }
            
            context.checkpoint();
            cluster(() -> cluster.applyDeployment(namespace, manifests.deployment(desired)));
            log.debug("Synced {}/{}", namespace, desired.name());
        }
        
        log.info("Synced {} workload(s) in {} namespace(s) for scope {}", workloads.size(), namespaces.size(), task.scope());
    }
}
