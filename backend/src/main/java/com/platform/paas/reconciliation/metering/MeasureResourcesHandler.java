package com.platform.paas.reconciliation.metering;

import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.reconciliation.AbstractTaskHandler;
import com.platform.paas.reconciliation.BoundResource;
import com.platform.paas.reconciliation.DesiredStateRepository;
import com.platform.paas.worker.TaskContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Meters bound service resources, one unit per resource.
 */
@Component
public class MeasureResourcesHandler extends AbstractTaskHandler {
    
    static final String TYPE = "resource";
    
    private final DesiredStateRepository desiredState;
    private final MeasurementRecorder recorder;
    private final Clock clock;
    
    public MeasureResourcesHandler(DesiredStateRepository desiredState, MeasurementRecorder recorder, Clock clock) {
        this.desiredState = desiredState;
        this.recorder = recorder;
        this.clock = clock;
    }
    
    @Override
    public TaskKind kind() {
        return TaskKind.MEASURE_RESOURCES;
    }
    
    @Override
    public void handle(ReconciliationTask task, TaskContext context) {
        Instant period = MeteringPeriod.startOf(task);
        Instant now = clock.instant();
        List<BoundResource> resources = store(() -> desiredState.boundResources(task.scope()));
        List<Measurement> measurements = resources.stream()
            .map(r -> Measurement.of(TYPE, r.tenantId(), r.appId(), r.name(), r.plan(), "number", 1, period, now))
            .toList();
        recorder.record(context, TYPE, measurements);
    }
}
