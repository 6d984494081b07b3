package com.platform.paas.reconciliation.metering;

import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.reconciliation.AbstractTaskHandler;
import com.platform.paas.reconciliation.DesiredStateRepository;
import com.platform.paas.reconciliation.DesiredWorkload;
import com.platform.paas.worker.TaskContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Meters running replicas per workload against its plan.
 */
@Component
public class MeasureAppsHandler extends AbstractTaskHandler {
    
    static final String TYPE = "limits";
    
    private final DesiredStateRepository desiredState;
    private final MeasurementRecorder recorder;
    private final Clock clock;
    
    public MeasureAppsHandler(DesiredStateRepository desiredState, MeasurementRecorder recorder, Clock clock) {
        this.desiredState = desiredState;
        this.recorder = recorder;
        this.clock = clock;
    }
    
    @Override
    public TaskKind kind() {
        return TaskKind.MEASURE_APPS;
    }
    
    @Override
    public void handle(ReconciliationTask task, TaskContext context) {
        Instant period = MeteringPeriod.startOf(task);
        Instant now = clock.instant();
        List<DesiredWorkload> workloads = store(() -> desiredState.workloads(task.scope()));
        List<Measurement> measurements = workloads.stream()
            .map(w -> Measurement.of(TYPE, w.tenantId(), w.appId(), w.name(), w.planId(), "number",
                w.workload().replicaCount(), period, now))
            .toList();
        recorder.record(context, TYPE, measurements);
    }
}
