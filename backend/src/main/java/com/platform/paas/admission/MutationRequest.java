package com.platform.paas.admission;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A tenant's request to create or update a workload.
 * A null plan id selects the catalog's default plan.
 */
public record MutationRequest(
    @NotBlank String tenantId,
    @NotNull @Valid WorkloadDescriptor workload,
    String planId,
    Instant submittedAt
) {
}
