package com.platform.paas.queue;

import java.util.Map;

/**
 * Point-in-time view of queue depth per band.
 */
public record QueueStats(
    boolean available,
    Map<Band, Integer> ready,
    Map<Band, Integer> delayed,
    Map<Band, Integer> inFlight,
    int dead
) {
    
    public int totalPending() {
        return ready.values().stream().mapToInt(Integer::intValue).sum()
            + delayed.values().stream().mapToInt(Integer::intValue).sum();
    }
}
