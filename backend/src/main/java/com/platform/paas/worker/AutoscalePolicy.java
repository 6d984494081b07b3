package com.platform.paas.worker;

/**
 * Decides the executor count of one band from periodic samples.
 *
 * <p>Scales up when the ready backlog exceeds {@code scaleUpThreshold} tasks per live executor
 * for {@code sustainSamples} consecutive samples, and down by one when the band has had
 * idle executors and no backlog for the same number of samples. Not thread-safe; sampled
 * from the single autoscale thread.
 */
public class AutoscalePolicy {
    
    private final WorkerPoolProperties.BandSettings settings;
    private int backlogStreak;
    private int idleStreak;
    
    public AutoscalePolicy(WorkerPoolProperties.BandSettings settings) {
        this.settings = settings;
    }
    
    /**
     * @param live       executors currently running
     * @param readyDepth tasks that could be claimed now
     * @param busy       executors currently running a task
     * @return desired executor count, always within the band's bounds
     */
    public int sample(int live, int readyDepth, int busy) {
        int current = clamp(live);
        int threshold = Math.max(1, settings.getScaleUpThreshold());
        
        if (readyDepth > (long) current * threshold) {
            idleStreak = 0;
            if (++backlogStreak >= settings.getSustainSamples()) {
                backlogStreak = 0;
                int wanted = (readyDepth + threshold - 1) / threshold;
                return clamp(Math.max(current + 1, wanted));
            }
            return current;
        }
        
        if (readyDepth == 0 && busy < current) {
            backlogStreak = 0;
            if (++idleStreak >= settings.getSustainSamples()) {
                idleStreak = 0;
                return clamp(Math.max(busy, current - 1));
            }
            return current;
        }
        
        backlogStreak = 0;
        idleStreak = 0;
        return current;
    }
    
    private int clamp(int value) {
        return Math.max(settings.getMin(), Math.min(settings.getMax(), value));
    }
}
