package com.platform.paas.schedule;

import com.platform.paas.queue.Band;
import com.platform.paas.queue.TaskKind;

import java.util.List;

/**
 * The periodic schedules and the tasks each firing enqueues.
 */
public enum PeriodicSchedule {
    
    HOURLY("hourly", Band.MIDDLE, List.of(
        TaskKind.MEASURE_NETWORKS,
        TaskKind.MEASURE_LOADBALANCERS)),
    
    DAILY("daily", Band.LOW, List.of(
        TaskKind.SYNC_STATE,
        TaskKind.MEASURE_APPS,
        TaskKind.MEASURE_RESOURCES,
        TaskKind.MEASURE_VOLUMES,
        TaskKind.CLEAR_STALE_SOCIAL_LINKS));
    
    private final String id;
    private final Band band;
    private final List<TaskKind> kinds;
    
    PeriodicSchedule(String id, Band band, List<TaskKind> kinds) {
        this.id = id;
        this.band = band;
        this.kinds = kinds;
    }
    
    public String id() {
        return id;
    }
    
    public List<TaskKind> kinds() {
        return kinds;
    }
    
    /**
     * sync-state runs on the high band whatever schedule enqueues it.
     */
    public Band bandFor(TaskKind kind) {
        return kind == TaskKind.SYNC_STATE ? Band.HIGH : band;
    }
    
    public static PeriodicSchedule fromId(String value) {
        for (PeriodicSchedule schedule : values()) {
            if (schedule.id.equalsIgnoreCase(value) || schedule.name().equalsIgnoreCase(value)) {
                return schedule;
            }
        }
        throw new IllegalArgumentException("Unknown schedule: " + value);
    }
}
