package com.platform.paas.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single resource-quantity rule: values below {@code floor} are raised to it,
 * values above {@code ceiling} are refused.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LimitSpec(
    String id,
    ResourceKind kind,
    String floor,
    String ceiling,
    String unit
) {
}
