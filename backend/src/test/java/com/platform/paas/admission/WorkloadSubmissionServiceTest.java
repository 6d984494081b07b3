package com.platform.paas.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.paas.catalog.ResourceKind;
import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.persistence.EntityMappers;
import com.platform.paas.persistence.repository.ServiceResourceJpaRepository;
import com.platform.paas.persistence.repository.WorkloadJpaRepository;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.RetryPolicy;
import com.platform.paas.reconciliation.DesiredStateRepository;
import com.platform.paas.reconciliation.DesiredWorkload;
import com.platform.paas.support.MutableClock;
import com.platform.paas.support.TestConfigurations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class WorkloadSubmissionServiceTest {

    @Autowired
    private WorkloadJpaRepository workloads;

    @Autowired
    private ServiceResourceJpaRepository resources;

    private ReconciliationQueue queue;
    private DesiredStateRepository desiredState;
    private WorkloadSubmissionService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(TestConfigurations.EPOCH);
        MetricsRegistry metrics = new MetricsRegistry(new SimpleMeterRegistry());
        queue = new ReconciliationQueue(clock,
            new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofMinutes(1)), 0, metrics);
        desiredState = new DesiredStateRepository(workloads, resources, new EntityMappers(new ObjectMapper()));
        AdmissionGate gate = new AdmissionGate(TestConfigurations.defaults(), queue, metrics, clock);
        service = new WorkloadSubmissionService(gate, desiredState);
    }

    @Test
    void shouldStoreStateAndEnqueueSync() {
        RewrittenRequest rewritten = service.submit(request("starter", "300m"));

        assertEquals(rewritten.taskId(), queue.poll(Band.HIGH).orElseThrow().id());
        assertEquals("starter", desiredState.find("acme", "shop", "web").orElseThrow().planId());
    }

    @Test
    void shouldLeaveNoStateWhenTheQueueRefusesANewWorkload() {
        queue.close();

        AdmissionRejectedException e = assertThrows(AdmissionRejectedException.class,
            () -> service.submit(request("starter", "300m")));

        assertEquals(RejectionReason.QUEUE_UNAVAILABLE, e.getRejection().reason());
        assertTrue(desiredState.find("acme", "shop", "web").isEmpty());
        assertEquals(0, workloads.count());
    }

    @Test
    void shouldRestorePreviousStateWhenTheQueueRefusesAnUpdate() {
        service.submit(request("starter", "300m"));
        queue.close();

        assertThrows(AdmissionRejectedException.class, () -> service.submit(request("standard", "700m")));

        DesiredWorkload stored = desiredState.find("acme", "shop", "web").orElseThrow();
        assertEquals("starter", stored.planId());
        assertEquals("300m", stored.workload().containers().get(0).requests().get(ResourceKind.CPU));
    }

    @Test
    void shouldNotStoreRejectedRequests() {
        assertThrows(AdmissionRejectedException.class, () -> service.submit(request("starter", "1000m")));

        assertEquals(0, workloads.count());
        assertEquals(0, queue.stats().totalPending());
    }

    private static MutationRequest request(String planId, String cpu) {
        ContainerResources container = new ContainerResources("web", "nginx", Map.of(ResourceKind.CPU, cpu), Map.of());
        return new MutationRequest("acme", new WorkloadDescriptor("shop", "web", 1, List.of(container), null),
            planId, null);
    }
}
