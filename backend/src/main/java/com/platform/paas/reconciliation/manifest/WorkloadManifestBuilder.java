package com.platform.paas.reconciliation.manifest;

import com.platform.paas.admission.ContainerResources;
import com.platform.paas.admission.VolumeRequest;
import com.platform.paas.catalog.ResourceKind;
import com.platform.paas.config.ControllerConfiguration;
import com.platform.paas.config.ResourceTemplates;
import com.platform.paas.reconciliation.DesiredWorkload;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds cluster manifests for a desired workload.
 * Secrets, pod volumes and volume claims start from the configured templates;
 * values derived from the workload override template values.
 */
@Component
public class WorkloadManifestBuilder {
    
    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY = "paas-controller";
    public static final String TENANT_LABEL = "paas.platform/tenant";
    public static final String PLAN_LABEL = "paas.platform/plan";
    public static final String APP_LABEL = "paas.platform/app";
    
    private final ResourceTemplates templates;
    private final String defaultImage;
    
    public WorkloadManifestBuilder(
            ControllerConfiguration configuration,
            @Value("${controlplane.workloads.default-image:registry.local/paas/slugrunner:latest}") String defaultImage) {
        this.templates = configuration.templates();
        this.defaultImage = defaultImage;
    }
    
    public Map<String, String> namespaceLabels(DesiredWorkload desired) {
        return Map.of(
            MANAGED_BY_LABEL, MANAGED_BY,
            TENANT_LABEL, desired.tenantId(),
            APP_LABEL, desired.appId()
        );
    }
    
    public Map<String, Object> deployment(DesiredWorkload desired) {
        Map<String, Object> selector = selectorLabels(desired);
        Map<String, Object> labels = new LinkedHashMap<>(selector);
        labels.put(MANAGED_BY_LABEL, MANAGED_BY);
        labels.put(TENANT_LABEL, desired.tenantId());
        labels.put(PLAN_LABEL, desired.planId());
        
        List<Object> containers = new ArrayList<>();
        for (ContainerResources container : desired.workload().containers()) {
            containers.add(container(container, desired.workload().volumes()));
        }
        List<Object> volumes = new ArrayList<>();
        for (VolumeRequest volume : desired.workload().volumes()) {
            volumes.add(ManifestMerger.merge(templates.volume(), Map.of(
                "name", volume.name(),
                "persistentVolumeClaim", Map.of("claimName", claimName(desired, volume))
            )));
        }
        
        Map<String, Object> podSpec = new LinkedHashMap<>();
        podSpec.put("containers", containers);
        if (!volumes.isEmpty()) {
            podSpec.put("volumes", volumes);
        }
        
        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("apiVersion", "apps/v1");
        manifest.put("kind", "Deployment");
        manifest.put("metadata", metadata(desired.name(), desired.namespace(), labels));
        manifest.put("spec", Map.of(
            "replicas", desired.workload().replicaCount(),
            "selector", Map.of("matchLabels", selector),
            "template", Map.of(
                "metadata", Map.of("labels", labels),
                "spec", podSpec
            )
        ));
        return manifest;
    }
    
    public Map<String, Object> persistentVolumeClaim(DesiredWorkload desired, VolumeRequest volume) {
        Map<String, Object> overlay = new LinkedHashMap<>();
        overlay.put("apiVersion", "v1");
        overlay.put("kind", "PersistentVolumeClaim");
        overlay.put("metadata", metadata(claimName(desired, volume), desired.namespace(), ownerLabels(desired)));
        overlay.put("spec", Map.of("resources", Map.of("requests", Map.of("storage", volume.size()))));
        return ManifestMerger.merge(templates.volumeClaim(), overlay);
    }
    
    public Map<String, Object> secret(DesiredWorkload desired) {
        Map<String, Object> overlay = new LinkedHashMap<>();
        overlay.put("apiVersion", "v1");
        overlay.put("kind", "Secret");
        overlay.put("metadata", metadata(secretName(desired), desired.namespace(), ownerLabels(desired)));
        return ManifestMerger.merge(templates.secret(), overlay);
    }
    
    public static String claimName(DesiredWorkload desired, VolumeRequest volume) {
        return desired.name() + "-" + volume.name();
    }
    
    public static String secretName(DesiredWorkload desired) {
        return desired.name() + "-env";
    }
    
    private Map<String, Object> container(ContainerResources container, List<VolumeRequest> volumes) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("name", container.name());
        spec.put("image", container.image() != null ? container.image() : defaultImage);
        Map<String, Object> resources = new LinkedHashMap<>();
        if (!container.requests().isEmpty()) {
            resources.put("requests", quantities(container.requests()));
        }
        if (!container.limits().isEmpty()) {
            resources.put("limits", quantities(container.limits()));
        }
        spec.put("resources", resources);
        if (!volumes.isEmpty()) {
            List<Object> mounts = new ArrayList<>();
            for (VolumeRequest volume : volumes) {
                mounts.add(Map.of("name", volume.name(), "mountPath", "/data/" + volume.name()));
            }
            spec.put("volumeMounts", mounts);
        }
        return spec;
    }
    
    private static Map<String, Object> quantities(Map<ResourceKind, String> values) {
        Map<String, Object> result = new LinkedHashMap<>();
        values.forEach((kind, quantity) -> result.put(kind.key(), quantity));
        return result;
    }
    
    private static Map<String, Object> selectorLabels(DesiredWorkload desired) {
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("app", desired.appId());
        labels.put("workload", desired.name());
        return labels;
    }
    
    private static Map<String, Object> ownerLabels(DesiredWorkload desired) {
        Map<String, Object> labels = selectorLabels(desired);
        labels.put(TENANT_LABEL, desired.tenantId());
        return labels;
    }
    
    private static Map<String, Object> metadata(String name, String namespace, Map<String, Object> labels) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", name);
        metadata.put("namespace", namespace);
        metadata.put("labels", labels);
        return metadata;
    }
}
