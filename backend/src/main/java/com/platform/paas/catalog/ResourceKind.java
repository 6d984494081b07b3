package com.platform.paas.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Resource dimensions a limit spec can constrain.
 */
public enum ResourceKind {
    CPU("cpu"),
    MEMORY("memory"),
    STORAGE("storage"),
    EPHEMERAL_STORAGE("ephemeral-storage");
    
    private final String key;
    
    ResourceKind(String key) {
        this.key = key;
    }
    
    /**
     * Kubernetes resource name, also used as the JSON key.
     */
    @JsonValue
    public String key() {
        return key;
    }
    
    @JsonCreator
    public static ResourceKind fromKey(String key) {
        return Arrays.stream(values())
            .filter(kind -> kind.key.equalsIgnoreCase(key) || kind.name().equalsIgnoreCase(key))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown resource kind: " + key));
    }
    
    @Override
    public String toString() {
        return key;
    }
}
