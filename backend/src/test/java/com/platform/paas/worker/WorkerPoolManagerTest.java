package com.platform.paas.worker;

import com.platform.paas.observability.MetricsRegistry;
import com.platform.paas.queue.Band;
import com.platform.paas.queue.ReconciliationQueue;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.RetryPolicy;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import com.platform.paas.schedule.ScheduleGenerations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolManagerTest {

    private static final int TASKS = 10;

    private ReconciliationQueue queue;
    private SimpleMeterRegistry meterRegistry;
    private CountDownLatch release;
    private CountDownLatch done;
    private WorkerPoolManager manager;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        MetricsRegistry metrics = new MetricsRegistry(meterRegistry);
        queue = new ReconciliationQueue(Clock.systemUTC(),
            new RetryPolicy(3, Duration.ofMinutes(1), Duration.ofMinutes(10)), 0, metrics);
        release = new CountDownLatch(1);
        done = new CountDownLatch(TASKS);

        WorkerPoolProperties properties = new WorkerPoolProperties();
        properties.setPollTimeout(Duration.ofMillis(50));
        WorkerPoolProperties.BandSettings low = new WorkerPoolProperties.BandSettings(1, 4);
        low.setSustainSamples(1);
        low.setTimeout(Duration.ofSeconds(10));
        properties.setLow(low);

        manager = new WorkerPoolManager(queue, new TaskHandlerRegistry(List.of(blockingHandler())),
            new ScheduleGenerations(), properties, metrics);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        queue.close();
        manager.drain(Duration.ofSeconds(5));
    }

    @Test
    void shouldIgnoreAutoscaleTicksBeforeStart() {
        manager.autoscale();

        assertFalse(manager.isStarted());
        assertEquals(0, manager.status().get(Band.LOW).live());
    }

    @Test
    void shouldScaleUpOnBacklogAndBackDownWhenIdle() throws InterruptedException {
        manager.start();
        for (int i = 0; i < TASKS; i++) {
            queue.enqueue(ReconciliationTask.of(TaskKind.MEASURE_APPS, Band.LOW, TaskScope.all(), null));
        }
        awaitCondition(() -> manager.status().get(Band.LOW).busy() == 1);

        manager.autoscale();

        assertEquals(4, manager.status().get(Band.LOW).live());
        assertEquals(1, manager.status().get(Band.HIGH).live());
        assertEquals(1.0, meterRegistry.find("controlplane.workers.scaling")
            .tag("band", "low").tag("direction", "up").counter().count());

        release.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        awaitCondition(() -> manager.status().get(Band.LOW).busy() == 0);

        manager.autoscale();
        awaitCondition(() -> manager.status().get(Band.LOW).live() == 3);
        manager.autoscale();
        awaitCondition(() -> manager.status().get(Band.LOW).live() == 2);
        manager.autoscale();
        awaitCondition(() -> manager.status().get(Band.LOW).live() == 1);
        manager.autoscale();

        assertEquals(1, manager.status().get(Band.LOW).live());
        assertEquals(1, manager.status().get(Band.LOW).min());
    }

    private TaskHandler blockingHandler() {
        return new TaskHandler() {
            @Override
            public TaskKind kind() {
                return TaskKind.MEASURE_APPS;
            }

            @Override
            public void handle(ReconciliationTask task, TaskContext context) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                done.countDown();
            }
        };
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            assertTrue(System.nanoTime() < deadline, "condition not met within 5s");
            Thread.sleep(10);
        }
    }
}
