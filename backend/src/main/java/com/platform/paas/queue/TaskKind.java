package com.platform.paas.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of reconciliation work and the band each runs on unless stated otherwise.
 */
public enum TaskKind {
    SYNC_STATE("sync-state", Band.HIGH),
    MEASURE_APPS("measure-apps", Band.LOW),
    MEASURE_RESOURCES("measure-resources", Band.LOW),
    MEASURE_VOLUMES("measure-volumes", Band.LOW),
    MEASURE_NETWORKS("measure-networks", Band.MIDDLE),
    MEASURE_LOADBALANCERS("measure-loadbalancers", Band.MIDDLE),
    CLEAR_STALE_SOCIAL_LINKS("clear-stale-social-links", Band.LOW);
    
    private final String wireName;
    private final Band defaultBand;
    
    TaskKind(String wireName, Band defaultBand) {
        this.wireName = wireName;
        this.defaultBand = defaultBand;
    }
    
    @JsonValue
    public String wireName() {
        return wireName;
    }
    
    public Band defaultBand() {
        return defaultBand;
    }
    
    @JsonCreator
    public static TaskKind fromWireName(String value) {
        return Arrays.stream(values())
            .filter(k -> k.wireName.equalsIgnoreCase(value) || k.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown task kind: " + value));
    }
    
    @Override
    public String toString() {
        return wireName;
    }
}
