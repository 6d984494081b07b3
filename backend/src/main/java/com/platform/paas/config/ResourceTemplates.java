package com.platform.paas.config;

import com.platform.paas.error.ConfigurationException;

import java.util.List;
import java.util.Map;

/**
 * Object templates merged under the manifests that sync-state applies.
 * Each template is a JSON object tree (maps, lists, scalars) without null values.
 */
public record ResourceTemplates(
    Map<String, Object> secret,
    Map<String, Object> volume,
    Map<String, Object> volumeClaim
) {
    
    /**
     * @throws ConfigurationException if a template holds a null value at any depth
     */
    public ResourceTemplates {
        secret = copyOf("secret-template", secret);
        volume = copyOf("volume-template", volume);
        volumeClaim = copyOf("volume-claim-template", volumeClaim);
    }
    
    public static ResourceTemplates empty() {
        return new ResourceTemplates(Map.of(), Map.of(), Map.of());
    }
    
    private static Map<String, Object> copyOf(String template, Map<String, Object> source) {
        if (source == null) {
            return Map.of();
        }
        requireValues(template, "", source);
        return Map.copyOf(source);
    }
    
    private static void requireValues(String template, String path, Object value) {
        if (value == null) {
            throw new ConfigurationException(template, "null value at " + path
                + "; omit the key instead");
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, child) -> requireValues(template, path + "/" + key, child));
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                requireValues(template, path + "/" + i, list.get(i));
            }
        }
    }
}
