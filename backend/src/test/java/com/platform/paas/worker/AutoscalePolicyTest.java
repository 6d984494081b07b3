package com.platform.paas.worker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AutoscalePolicyTest {

    @Test
    void shouldScaleUpOnlyAfterSustainedBacklog() {
        AutoscalePolicy policy = new AutoscalePolicy(new WorkerPoolProperties.BandSettings(1, 8));

        assertEquals(1, policy.sample(1, 10, 1));
        assertEquals(1, policy.sample(1, 10, 1));
        assertEquals(5, policy.sample(1, 10, 1));
    }

    @Test
    void shouldResetBacklogStreakWhenBacklogClears() {
        AutoscalePolicy policy = new AutoscalePolicy(new WorkerPoolProperties.BandSettings(1, 8));

        policy.sample(1, 10, 1);
        policy.sample(1, 10, 1);
        assertEquals(1, policy.sample(1, 1, 1));
        assertEquals(1, policy.sample(1, 10, 1));
    }

    @Test
    void shouldNeverExceedTheBandMaximum() {
        AutoscalePolicy policy = new AutoscalePolicy(new WorkerPoolProperties.BandSettings(1, 4));

        policy.sample(2, 100, 2);
        policy.sample(2, 100, 2);
        assertEquals(4, policy.sample(2, 100, 2));
    }

    @Test
    void shouldScaleDownOneAtATimeWhenIdle() {
        AutoscalePolicy policy = new AutoscalePolicy(new WorkerPoolProperties.BandSettings(1, 8));

        assertEquals(5, policy.sample(5, 0, 0));
        assertEquals(5, policy.sample(5, 0, 0));
        assertEquals(4, policy.sample(5, 0, 0));
    }

    @Test
    void shouldNotShrinkBelowMinimumOrBusyExecutors() {
        AutoscalePolicy policy = new AutoscalePolicy(new WorkerPoolProperties.BandSettings(2, 8));

        for (int i = 0; i < 3; i++) {
            assertEquals(2, policy.sample(2, 0, 0));
        }
        for (int i = 0; i < 3; i++) {
            assertEquals(3, policy.sample(3, 0, 3));
        }
    }
}
