package com.platform.paas.reconciliation;

/**
 * A service resource currently bound to an app.
 */
public record BoundResource(String tenantId, String appId, String name, String plan) {
}
