package com.platform.paas.admission;

import jakarta.validation.constraints.NotBlank;

/**
 * A persistent volume request. Size uses Kubernetes quantity notation.
 */
public record VolumeRequest(@NotBlank String name, @NotBlank String size) {
}
