package com.platform.paas.connectors.kubernetes;

import java.util.List;
import java.util.Map;

/**
 * Operations the reconciliation handlers need from the cluster API.
 * Manifests are plain maps so that configured templates can be merged into them.
 * Every apply is idempotent: applying the same manifest twice leaves the same object.
 *
 * @throws ClusterOperationException from every method on failure
 */
public interface ClusterClient {
    
    void ensureNamespace(String namespace, Map<String, String> labels);
    
    void applyDeployment(String namespace, Map<String, Object> manifest);
    
    void applyPersistentVolumeClaim(String namespace, Map<String, Object> manifest);
    
    void applySecret(String namespace, Map<String, Object> manifest);
    
    List<ServiceSummary> listServices(String namespace);
    
    /**
     * Name and type of a cluster Service.
     */
    record ServiceSummary(String name, String type) {
        
        public boolean isLoadBalancer() {
            return "LoadBalancer".equals(type);
        }
    }
}
