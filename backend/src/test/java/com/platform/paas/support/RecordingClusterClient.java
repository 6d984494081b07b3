package com.platform.paas.support;

import com.platform.paas.connectors.kubernetes.ClusterClient;
import com.platform.paas.connectors.kubernetes.ClusterOperationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory cluster keeping the last applied object per namespace, kind and name,
 * with an optional failure injected into every write.
 */
public class RecordingClusterClient implements ClusterClient {

    private final Map<String, Map<String, Object>> objects = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> namespaces = new LinkedHashMap<>();
    private final Map<String, List<ServiceSummary>> services = new HashMap<>();
    private final List<String> writes = new ArrayList<>();
    private ClusterOperationException failure;

    public void failWith(ClusterOperationException failure) {
        this.failure = failure;
    }

    public void addService(String namespace, String name, String type) {
        services.computeIfAbsent(namespace, ns -> new ArrayList<>()).add(new ServiceSummary(name, type));
    }

    @Override
    public void ensureNamespace(String namespace, Map<String, String> labels) {
        write("Namespace/" + namespace);
        namespaces.put(namespace, labels);
    }

    @Override
    public void applyDeployment(String namespace, Map<String, Object> manifest) {
        apply(namespace, manifest);
    }

    @Override
    public void applyPersistentVolumeClaim(String namespace, Map<String, Object> manifest) {
        apply(namespace, manifest);
    }

    @Override
    public void applySecret(String namespace, Map<String, Object> manifest) {
        apply(namespace, manifest);
    }

    @Override
    public List<ServiceSummary> listServices(String namespace) {
        if (failure != null) {
            throw failure;
        }
        return services.getOrDefault(namespace, List.of());
    }

    public Map<String, Map<String, Object>> objects() {
        return objects;
    }

    public Map<String, Map<String, String>> namespaces() {
        return namespaces;
    }

    public List<String> writes() {
        return writes;
    }

    @SuppressWarnings("unchecked")
    private void apply(String namespace, Map<String, Object> manifest) {
        Map<String, Object> metadata = (Map<String, Object>) manifest.get("metadata");
        String key = namespace + "/" + manifest.get("kind") + "/" + metadata.get("name");
        write(key);
        objects.put(key, manifest);
    }

    private void write(String key) {
        if (failure != null) {
            throw failure;
        }
        writes.add(key);
    }
}
