package com.platform.paas.admission;

import com.platform.paas.catalog.ResourceKind;
import jakarta.validation.constraints.NotBlank;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Image and resource requests and limits of one container, keyed by kind.
 * A kind missing from a map is not requested.
 */
public record ContainerResources(
    @NotBlank String name,
    String image,
    Map<ResourceKind, String> requests,
    Map<ResourceKind, String> limits
) {
    
    public ContainerResources {
        requests = copy(requests);
        limits = copy(limits);
    }
    
    private static Map<ResourceKind, String> copy(Map<ResourceKind, String> values) {
        Map<ResourceKind, String> copy = new EnumMap<>(ResourceKind.class);
        if (values != null) {
            copy.putAll(values);
        }
        return Collections.unmodifiableMap(copy);
    }
}
