package com.platform.paas.reconciliation;

import com.platform.paas.admission.WorkloadDescriptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * A workload as recorded in the state store after admission.
 */
public record DesiredWorkload(
    String tenantId,
    String planId,
    WorkloadDescriptor workload,
    Instant updatedAt
) {
    
    private static final int TENANT_SUFFIX_BYTES = 4;
    
    /**
     * Longest app id whose namespace still fits a 63 character DNS label.
     */
    public static final int MAX_APP_ID_LENGTH = 63 - 1 - TENANT_SUFFIX_BYTES * 2;
    
    public String namespace() {
        return namespaceOf(tenantId, workload.appId());
    }
    
    public String appId() {
        return workload.appId();
    }
    
    public String name() {
        return workload.name();
    }
    
    /**
     * Cluster namespace of a tenant's app: the app id followed by a fixed-length digest of
     * the tenant id, so equal app ids of different tenants never share a namespace.
     */
    public static String namespaceOf(String tenantId, String appId) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(tenantId.getBytes(StandardCharsets.UTF_8));
            return appId + "-" + HexFormat.of().formatHex(digest, 0, TENANT_SUFFIX_BYTES);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
