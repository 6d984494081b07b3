package com.platform.paas.reconciliation.metering;

import com.platform.paas.connectors.kubernetes.ClusterClient;
import com.platform.paas.connectors.kubernetes.ClusterClient.ServiceSummary;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.reconciliation.DesiredStateRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.Predicate;

/**
 * Meters internal services (everything but load balancers) per app.
 */
@Component
public class MeasureNetworksHandler extends ServiceCountHandler {
    
    public MeasureNetworksHandler(
            DesiredStateRepository desiredState,
            ClusterClient cluster,
            MeasurementRecorder recorder,
            Clock clock) {
        super(desiredState, cluster, recorder, clock);
    }
    
    @Override
    public TaskKind kind() {
        return TaskKind.MEASURE_NETWORKS;
    }
    
    @Override
    String type() {
        return "network";
    }
    
    @Override
    Predicate<ServiceSummary> counts() {
        return service -> !service.isLoadBalancer();
    }
}
