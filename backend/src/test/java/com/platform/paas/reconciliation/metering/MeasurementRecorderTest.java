package com.platform.paas.reconciliation.metering;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.paas.connectors.kafka.MeasurementPublisher;
import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.persistence.EntityMappers;
import com.platform.paas.persistence.entity.MeasurementEntity;
import com.platform.paas.persistence.repository.MeasurementJpaRepository;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.GenerationStamp;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import com.platform.paas.schedule.ScheduleGenerations;
import com.platform.paas.support.TestConfigurations;
import com.platform.paas.worker.HandlerTransientException;
import com.platform.paas.worker.TaskContext;
import com.platform.paas.worker.TaskSupersededException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MeasurementRecorderTest {

    private MeasurementJpaRepository repository;
    private MeasurementPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private ScheduleGenerations generations;
    private MeasurementRecorder recorder;

    @BeforeEach
    void setUp() {
        repository = mock(MeasurementJpaRepository.class);
        publisher = mock(MeasurementPublisher.class);
        meterRegistry = new SimpleMeterRegistry();
        generations = new ScheduleGenerations();
        recorder = new MeasurementRecorder(repository, new EntityMappers(new ObjectMapper()), publisher,
            new MetricsRegistry(meterRegistry));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldStoreThenPublishKeyedRows() {
        ReconciliationTask task = task(null);
        List<Measurement> measurements = List.of(sample("web", 2), sample("worker", 1));

        int recorded = recorder.record(new TaskContext(task, generations), "limits", measurements);

        assertEquals(2, recorded);
        ArgumentCaptor<List<MeasurementEntity>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(saved.capture());
        assertEquals(measurements.get(0).key(), saved.getValue().get(0).getId());
        assertEquals(task.id(), saved.getValue().get(0).getTaskId());
        verify(publisher).publish(measurements);
        assertEquals(2.0, meterRegistry.get("controlplane.measurements.recorded").tag("type", "limits")
            .counter().count());
    }

    @Test
    void shouldSkipEmptyBatches() {
        assertEquals(0, recorder.record(new TaskContext(task(null), generations), "limits", List.of()));

        verifyNoInteractions(repository, publisher);
    }

    @Test
    void shouldTreatStoreOutageAsTransient() {
        when(repository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(HandlerTransientException.class,
            () -> recorder.record(new TaskContext(task(null), generations), "limits", List.of(sample("web", 1))));
        verify(publisher, never()).publish(any());
    }

    @Test
    void shouldTreatBrokerFailureAsTransient() {
        doThrow(new MeasurementPublisher.PublishException("broker down", null)).when(publisher).publish(anyList());

        assertThrows(HandlerTransientException.class,
            () -> recorder.record(new TaskContext(task(null), generations), "limits", List.of(sample("web", 1))));
    }

    @Test
    void shouldWriteNothingForSupersededGeneration() {
        generations.advance("hourly");
        ReconciliationTask task = task(new GenerationStamp("hourly", 1));
        generations.advance("hourly");

        assertThrows(TaskSupersededException.class,
            () -> recorder.record(new TaskContext(task, generations), "limits", List.of(sample("web", 1))));
        verifyNoInteractions(repository, publisher);
    }

    private static ReconciliationTask task(GenerationStamp stamp) {
        return ReconciliationTask.of(TaskKind.MEASURE_APPS, Band.MIDDLE, TaskScope.all(), stamp)
            .withEnqueue(TestConfigurations.EPOCH, 1);
    }

    private static Measurement sample(String name, long replicas) {
        Instant period = Instant.parse("2024-03-01T10:00:00Z");
        return Measurement.of("limits", "acme", "shop", name, "starter", "number", replicas, period,
            TestConfigurations.EPOCH);
    }
}
