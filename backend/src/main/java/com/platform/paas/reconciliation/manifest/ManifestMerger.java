package com.platform.paas.reconciliation.manifest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive merge of manifest maps. Nested maps merge key by key; any other value
 * in the overlay (lists included) replaces the base value. Inputs are never modified.
 */
public final class ManifestMerger {
    
    private ManifestMerger() {
    }
    
    /**
     * @throws IllegalArgumentException if a nested map has a key that is not a string
     */
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overlay) {
        return mergeMaps(base, overlay);
    }
    
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        return copyMap(source);
    }
    
    private static Map<String, Object> mergeMaps(Map<?, ?> base, Map<?, ?> overlay) {
        Map<String, Object> result = copyMap(base);
        for (Map.Entry<?, ?> entry : overlay.entrySet()) {
            String key = keyOf(entry.getKey());
            Object existing = result.get(key);
            Object incoming = entry.getValue();
            if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
                result.put(key, mergeMaps(existingMap, incomingMap));
            } else {
                result.put(key, copyValue(incoming));
            }
        }
        return result;
    }
    
    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(keyOf(entry.getKey()), copyValue(entry.getValue()));
        }
        return copy;
    }
    
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
    
    private static String keyOf(Object key) {
        if (key instanceof String name) {
            return name;
        }
        throw new IllegalArgumentException("Manifest keys must be strings, got " + key);
    }
}
