package com.platform.paas.lifecycle;

import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.RetryPolicy;
import com.platform.paas.support.MutableClock;
import com.platform.paas.support.TestConfigurations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ApplicationLifecycleManagerTest {

    private ApplicationEventPublisher publisher;
    private ReconciliationQueue queue;
    private ApplicationLifecycleManager lifecycle;

    @BeforeEach
    void setUp() {
        publisher = mock(ApplicationEventPublisher.class);
        queue = new ReconciliationQueue(new MutableClock(TestConfigurations.EPOCH),
            new RetryPolicy(5, Duration.ofSeconds(8), Duration.ofHours(1)), 0,
            new MetricsRegistry(new SimpleMeterRegistry()));
        lifecycle = new ApplicationLifecycleManager(publisher, TestConfigurations.defaults(), queue);
    }

    @Test
    void shouldNotBeReadyBeforeStartupCompletes() {
        assertEquals(List.of("lifecycle phase STARTING"), lifecycle.readinessProblems());
    }

    @Test
    void shouldBecomeReadyOnce() {
        lifecycle.markReady();
        lifecycle.markReady();

        assertTrue(lifecycle.isReady());
        verify(publisher, times(1)).publishEvent(any(AvailabilityChangeEvent.class));
    }

    @Test
    void shouldReportClosedQueueAndDraining() {
        lifecycle.markReady();
        lifecycle.startDraining();
        queue.close();

        assertFalse(lifecycle.isReady());
        assertEquals(List.of("reconciliation queue closed", "lifecycle phase DRAINING"),
            lifecycle.readinessProblems());
        assertEquals(ApplicationLifecycleManager.LifecyclePhase.DRAINING, lifecycle.getCurrentPhase());
    }

    @Test
    void shouldRefuseTrafficWhenDraining() {
        lifecycle.markReady();
        lifecycle.startDraining();
        lifecycle.startDraining();
        lifecycle.markStopped();

        verify(publisher, times(3)).publishEvent(any(AvailabilityChangeEvent.class));
        assertEquals(ApplicationLifecycleManager.LifecyclePhase.STOPPED, lifecycle.getStatus().phase());
    }

    @Test
    void shouldReportAdmissionListenerDownUntilReady() {
        AdmissionGateHealthIndicator indicator = new AdmissionGateHealthIndicator(lifecycle);

        Health starting = indicator.health();
        lifecycle.markReady();
        Health ready = indicator.health();
        queue.close();
        Health closed = indicator.health();

        assertEquals(Status.DOWN, starting.getStatus());
        assertEquals(Status.UP, ready.getStatus());
        assertEquals(Status.DOWN, closed.getStatus());
        assertEquals(List.of("reconciliation queue closed"), closed.getDetails().get("problems"));
    }
}
