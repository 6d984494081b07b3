package com.platform.paas.reconciliation;

import com.platform.paas.admission.ContainerResources;
import com.platform.paas.admission.VolumeRequest;
import com.platform.paas.admission.WorkloadDescriptor;
import com.platform.paas.catalog.ResourceKind;
import com.platform.paas.connectors.kubernetes.ClusterOperationException;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.GenerationStamp;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import com.platform.paas.reconciliation.manifest.WorkloadManifestBuilder;
import com.platform.paas.schedule.ScheduleGenerations;
import com.platform.paas.support.RecordingClusterClient;
import com.platform.paas.support.TestConfigurations;
import com.platform.paas.worker.HandlerFatalException;
import com.platform.paas.worker.HandlerTransientException;
import com.platform.paas.worker.TaskContext;
import com.platform.paas.worker.TaskSupersededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncStateHandlerTest {

    private static final String SHOP = DesiredWorkload.namespaceOf("acme", "shop");

    private DesiredStateRepository desiredState;
    private RecordingClusterClient cluster;
    private ScheduleGenerations generations;
    private SyncStateHandler handler;

    @BeforeEach
    void setUp() {
        desiredState = mock(DesiredStateRepository.class);
        cluster = new RecordingClusterClient();
        generations = new ScheduleGenerations();
        handler = new SyncStateHandler(desiredState,
            new WorkloadManifestBuilder(TestConfigurations.defaults(), "registry.local/default:1"), cluster);
    }

    @Test
    void shouldApplyNamespaceSecretClaimsAndDeployment() {
        when(desiredState.workloads(any())).thenReturn(List.of(workload("web"), workload("worker")));

        run(ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.app("acme", "shop")));

        assertEquals(List.of(
            "Namespace/" + SHOP,
            SHOP + "/Secret/web-env",
            SHOP + "/PersistentVolumeClaim/web-data",
            SHOP + "/Deployment/web",
            SHOP + "/Secret/worker-env",
            SHOP + "/PersistentVolumeClaim/worker-data",
            SHOP + "/Deployment/worker"), cluster.writes());
        assertEquals("acme", cluster.namespaces().get(SHOP).get(WorkloadManifestBuilder.TENANT_LABEL));
        assertEquals("shop", cluster.namespaces().get(SHOP).get(WorkloadManifestBuilder.APP_LABEL));
    }

    @Test
    void shouldKeepSameAppIdOfDifferentTenantsInSeparateNamespaces() {
        when(desiredState.workloads(any())).thenReturn(List.of(workload("web"), workload("globex", "web")));

        run(ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.all()));

        String globex = DesiredWorkload.namespaceOf("globex", "shop");
        assertNotEquals(SHOP, globex);
        assertEquals("acme", cluster.namespaces().get(SHOP).get(WorkloadManifestBuilder.TENANT_LABEL));
        assertEquals("globex", cluster.namespaces().get(globex).get(WorkloadManifestBuilder.TENANT_LABEL));
        assertTrue(cluster.objects().containsKey(SHOP + "/Deployment/web"));
        assertTrue(cluster.objects().containsKey(globex + "/Deployment/web"));
    }

    @Test
    void shouldConvergeToTheSameObjectsWhenRunTwice() {
        when(desiredState.workloads(any())).thenReturn(List.of(workload("web")));
        ReconciliationTask task = ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.all());

        run(task);
        Map<String, Map<String, Object>> first = new HashMap<>(cluster.objects());
        run(task);

        assertEquals(first, cluster.objects());
        assertEquals(3, cluster.objects().size());
    }

    @Test
    void shouldMapRetryableClusterErrorsToTransient() {
        when(desiredState.workloads(any())).thenReturn(List.of(workload("web")));
        cluster.failWith(new ClusterOperationException("apply", 503, true, "unavailable", null));

        assertThrows(HandlerTransientException.class,
            () -> run(ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.all())));
    }

    @Test
    void shouldMapRejectedManifestsToFatal() {
        when(desiredState.workloads(any())).thenReturn(List.of(workload("web")));
        cluster.failWith(new ClusterOperationException("apply", 422, false, "invalid", null));

        assertThrows(HandlerFatalException.class,
            () -> run(ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.all())));
    }

    @Test
    void shouldMapStateStoreOutageToTransient() {
        when(desiredState.workloads(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(HandlerTransientException.class,
            () -> run(ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.all())));
    }

    @Test
    void shouldMapStoreTimeoutsAndRecoverableErrorsToTransient() {
        ReconciliationTask task = ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.all());

        when(desiredState.workloads(any())).thenThrow(new QueryTimeoutException("slow"));
        assertThrows(HandlerTransientException.class, () -> run(task));

        when(desiredState.workloads(any())).thenThrow(new RecoverableDataAccessException("failover"));
        assertThrows(HandlerTransientException.class, () -> run(task));
    }

    @Test
    void shouldMapStoreConstraintViolationsToFatal() {
        when(desiredState.workloads(any())).thenThrow(new DataIntegrityViolationException("duplicate"));

        assertThrows(HandlerFatalException.class,
            () -> run(ReconciliationTask.of(TaskKind.SYNC_STATE, TaskScope.all())));
    }

    @Test
    void shouldStopBeforeWritingWhenSuperseded() {
        when(desiredState.workloads(any())).thenReturn(List.of(workload("web")));
        generations.advance("daily");
        ReconciliationTask task = ReconciliationTask.of(TaskKind.SYNC_STATE, Band.HIGH, TaskScope.all(),
            new GenerationStamp("daily", 1));
        generations.advance("daily");

        assertThrows(TaskSupersededException.class, () -> run(task));
        assertTrue(cluster.writes().isEmpty());
    }

    private void run(ReconciliationTask task) {
        handler.handle(task, new TaskContext(task, generations));
    }

    private static DesiredWorkload workload(String name) {
        return workload("acme", name);
    }

    private static DesiredWorkload workload(String tenant, String name) {
        return new DesiredWorkload(tenant, "starter",
            new WorkloadDescriptor("shop", name, 1,
                List.of(new ContainerResources(name, "nginx", Map.of(ResourceKind.CPU, "100m"), Map.of())),
                List.of(new VolumeRequest("data", "1Gi"))),
            TestConfigurations.EPOCH);
    }
}
