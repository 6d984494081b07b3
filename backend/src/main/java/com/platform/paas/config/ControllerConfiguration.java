package com.platform.paas.config;

import com.platform.paas.admission.ReservedNamePolicy;
import com.platform.paas.catalog.LimitCatalog;

import java.time.Instant;

/**
 * Everything loaded from configuration data at startup.
 * Built once, shared by reference, never mutated. A new catalog needs a new process.
 */
public record ControllerConfiguration(
    LimitCatalog catalog,
    ReservedNamePolicy namePolicy,
    ResourceTemplates templates,
    Instant loadedAt
) {
}
