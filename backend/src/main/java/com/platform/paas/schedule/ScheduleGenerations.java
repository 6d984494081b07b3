package com.platform.paas.schedule;

import com.platform.paas.queue.GenerationStamp;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic generation counter per schedule.
 * A stamped task is superseded once its schedule has fired again.
 */
@Component
public class ScheduleGenerations {
    
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();
    
    /**
     * Start a new generation for a schedule and return it.
     */
    public long advance(String schedule) {
        return counter(schedule).incrementAndGet();
    }
    
    public long current(String schedule) {
        AtomicLong counter = generations.get(schedule);
        return counter == null ? 0 : counter.get();
    }
    
    /**
     * Unstamped tasks are never superseded.
     */
    public boolean isSuperseded(GenerationStamp stamp) {
        return stamp != null && current(stamp.schedule()) > stamp.generation();
    }
    
    private AtomicLong counter(String schedule) {
        return generations.computeIfAbsent(schedule, s -> new AtomicLong());
    }
}
