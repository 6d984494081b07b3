package com.platform.paas.api;

import com.platform.paas.error.ResourceNotFoundException;
import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.QueueStats;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import com.platform.paas.schedule.PeriodicSchedule;
import com.platform.paas.schedule.ScheduledTrigger;
import com.platform.paas.worker.WorkerPoolManager;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReconciliationController.class)
class ReconciliationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconciliationQueue queue;

    @MockBean
    private WorkerPoolManager workerPools;

    @MockBean
    private ScheduledTrigger trigger;

    @MockBean
    private MetricsRegistry metricsRegistry;

    @Test
    void shouldReportQueueAndWorkerState() throws Exception {
        when(queue.stats()).thenReturn(new QueueStats(true,
            Map.of(Band.HIGH, 2, Band.MIDDLE, 0, Band.LOW, 5),
            Map.of(Band.HIGH, 1, Band.MIDDLE, 0, Band.LOW, 0),
            Map.of(Band.HIGH, 1, Band.MIDDLE, 0, Band.LOW, 1),
            0));
        when(workerPools.status()).thenReturn(Map.of(Band.HIGH, new WorkerPoolManager.PoolStatus(3, 1, 1, 32)));

        mockMvc.perform(get("/api/reconciliation/queue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queue.available").value(true))
            .andExpect(jsonPath("$.queue.ready.LOW").value(5))
            .andExpect(jsonPath("$.workers.HIGH.live").value(3));
    }

    @Test
    void shouldFireScheduleById() throws Exception {
        when(trigger.fire(PeriodicSchedule.HOURLY)).thenReturn(
            new ScheduledTrigger.Firing("hourly", 4, List.of("a", "b"), List.of()));

        mockMvc.perform(post("/api/reconciliation/fire/hourly"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.generation").value(4))
            .andExpect(jsonPath("$.taskIds.length()").value(2));
    }

    @Test
    void shouldRejectUnknownSchedule() throws Exception {
        mockMvc.perform(post("/api/reconciliation/fire/weekly"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors[0].field").value("schedule"));
        verify(trigger, never()).fire(any());
    }

    @Test
    void shouldEnqueueScopedSync() throws Exception {
        when(queue.enqueue(any(ReconciliationTask.class))).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(post("/api/reconciliation/sync").param("tenantId", "acme").param("appId", "shop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.band").value("HIGH"));

        ArgumentCaptor<ReconciliationTask> captor = ArgumentCaptor.forClass(ReconciliationTask.class);
        verify(queue).enqueue(captor.capture());
        assertEquals(TaskKind.SYNC_STATE, captor.getValue().kind());
        assertEquals(TaskScope.app("acme", "shop"), captor.getValue().scope());
    }

    @Test
    void shouldRequireTenantWhenAppGiven() throws Exception {
        mockMvc.perform(post("/api/reconciliation/sync").param("appId", "shop"))
            .andExpect(status().isBadRequest());
        verify(queue, never()).enqueue(any());
    }

    @Test
    void shouldReturn404ForUnknownDeadTask() throws Exception {
        when(queue.retryDead("missing"))
            .thenThrow(ResourceNotFoundException.deadTask("missing"));

        mockMvc.perform(post("/api/reconciliation/dead-tasks/missing/retry"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CP-302"))
            .andExpect(jsonPath("$.metadata.resourceType").value("Dead task"));
    }
}
