package com.platform.paas.reconciliation.metering;

import com.platform.paas.connectors.kubernetes.ClusterClient;
import com.platform.paas.connectors.kubernetes.ClusterClient.ServiceSummary;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.reconciliation.AbstractTaskHandler;
import com.platform.paas.reconciliation.DesiredStateRepository;
import com.platform.paas.reconciliation.DesiredWorkload;
import com.platform.paas.worker.TaskContext;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Meters the number of matching cluster services in each app namespace.
 */
abstract class ServiceCountHandler extends AbstractTaskHandler {
    
    private final DesiredStateRepository desiredState;
    private final ClusterClient cluster;
    private final MeasurementRecorder recorder;
    private final Clock clock;
    
    ServiceCountHandler(
            DesiredStateRepository desiredState,
            ClusterClient cluster,
            MeasurementRecorder recorder,
            Clock clock) {
        this.desiredState = desiredState;
        this.cluster = cluster;
        this.recorder = recorder;
        this.clock = clock;
    }
    
    abstract String type();
    
    abstract Predicate<ServiceSummary> counts();
    
    @Override
    public void handle(ReconciliationTask task, TaskContext context) {
        Instant period = MeteringPeriod.startOf(task);
        
        // namespace -> first workload seen in it, all of which share tenant and app
        Map<String, DesiredWorkload> namespaces = new LinkedHashMap<>();
        for (DesiredWorkload desired : store(() -> desiredState.workloads(task.scope()))) {
            namespaces.putIfAbsent(desired.namespace(), desired);
        }
        
        List<Measurement> measurements = new ArrayList<>();
        for (Map.Entry<String, DesiredWorkload> entry : namespaces.entrySet()) {
            String namespace = entry.getKey();
            DesiredWorkload owner = entry.getValue();
            List<ServiceSummary> services = cluster(() -> cluster.listServices(namespace));
            long count = services.stream().filter(counts()).count();
            measurements.add(Measurement.of(type(), owner.tenantId(), owner.appId(), namespace, type(), "number",
                count, period, clock.instant()));
        }
        recorder.record(context, type(), measurements);
    }
}
