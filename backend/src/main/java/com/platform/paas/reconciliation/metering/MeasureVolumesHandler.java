package com.platform.paas.reconciliation.metering;

import com.platform.paas.admission.VolumeRequest;
import com.platform.paas.catalog.ResourceQuantities;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.reconciliation.AbstractTaskHandler;
import com.platform.paas.reconciliation.DesiredStateRepository;
import com.platform.paas.reconciliation.DesiredWorkload;
import com.platform.paas.worker.HandlerFatalException;
import com.platform.paas.worker.TaskContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Meters provisioned volume size in bytes.
 */
@Component
public class MeasureVolumesHandler extends AbstractTaskHandler {
    
    static final String TYPE = "volume";
    
    private final DesiredStateRepository desiredState;
    private final MeasurementRecorder recorder;
    private final Clock clock;
    
    public MeasureVolumesHandler(DesiredStateRepository desiredState, MeasurementRecorder recorder, Clock clock) {
        this.desiredState = desiredState;
        this.recorder = recorder;
        this.clock = clock;
    }
    
    @Override
    public TaskKind kind() {
        return TaskKind.MEASURE_VOLUMES;
    }
    
    @Override
    public void handle(ReconciliationTask task, TaskContext context) {
        Instant period = MeteringPeriod.startOf(task);
        Instant now = clock.instant();
        List<Measurement> measurements = new ArrayList<>();
        for (DesiredWorkload desired : store(() -> desiredState.workloads(task.scope()))) {
            for (VolumeRequest volume : desired.workload().volumes()) {
                long bytes;
                try {
                    bytes = ResourceQuantities.toBytes(volume.size());
                } catch (IllegalArgumentException | ArithmeticException e) {
                    throw new HandlerFatalException("Stored volume size is not a quantity: " + volume.size(), e);
                }
                String subject = desired.name() + "/" + volume.name();
                measurements.add(Measurement.of(TYPE, desired.tenantId(), desired.appId(), subject,
                    volume.name(), "bytes", bytes, period, now));
            }
        }
        recorder.record(context, TYPE, measurements);
    }
}
