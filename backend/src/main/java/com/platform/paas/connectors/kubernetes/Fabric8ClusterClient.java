package com.platform.paas.connectors.kubernetes;

import com.platform.paas.core.CircuitBreakerManager;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link ClusterClient} backed by the fabric8 Kubernetes client.
 * 
 * Objects are written with server-side apply under a dedicated field manager, so a
 * repeated apply of the same manifest is a no-op on the server. Every call runs through
 * the {@code kubernetes} circuit breaker.
 */
@Slf4j
@Component
public class Fabric8ClusterClient implements ClusterClient {
    
    static final String FIELD_MANAGER = "paas-controller";
    
    private final KubernetesClient client;
    private final CircuitBreakerManager circuitBreakers;
    
    public Fabric8ClusterClient(KubernetesClient client, CircuitBreakerManager circuitBreakers) {
        this.client = client;
        this.circuitBreakers = circuitBreakers;
    }
    
    @Override
    public void ensureNamespace(String namespace, Map<String, String> labels) {
        call("ensureNamespace " + namespace, () -> {
            Namespace desired = new NamespaceBuilder()
                .withNewMetadata()
                    .withName(namespace)
                    .withLabels(labels)
                .endMetadata()
                .build();
            return client.namespaces().resource(desired)
                .fieldManager(FIELD_MANAGER)
                .forceConflicts()
                .serverSideApply();
        });
    }
    
    @Override
    public void applyDeployment(String namespace, Map<String, Object> manifest) {
        Deployment deployment = convert(manifest, Deployment.class);
        call("applyDeployment " + namespace + "/" + deployment.getMetadata().getName(), () ->
            client.apps().deployments().inNamespace(namespace).resource(deployment)
                .fieldManager(FIELD_MANAGER)
                .forceConflicts()
                .serverSideApply());
    }
    
    @Override
    public void applyPersistentVolumeClaim(String namespace, Map<String, Object> manifest) {
        PersistentVolumeClaim claim = convert(manifest, PersistentVolumeClaim.class);
        call("applyPersistentVolumeClaim " + namespace + "/" + claim.getMetadata().getName(), () ->
            client.persistentVolumeClaims().inNamespace(namespace).resource(claim)
                .fieldManager(FIELD_MANAGER)
                .forceConflicts()
                .serverSideApply());
    }
    
    @Override
    public void applySecret(String namespace, Map<String, Object> manifest) {
        Secret secret = convert(manifest, Secret.class);
        call("applySecret " + namespace + "/" + secret.getMetadata().getName(), () ->
            client.secrets().inNamespace(namespace).resource(secret)
                .fieldManager(FIELD_MANAGER)
                .forceConflicts()
                .serverSideApply());
    }
    
    @Override
    public List<ServiceSummary> listServices(String namespace) {
        return call("listServices " + namespace, () ->
            client.services().inNamespace(namespace).list().getItems().stream()
                .map(s -> new ServiceSummary(s.getMetadata().getName(), s.getSpec().getType()))
                .toList());
    }
    
    private <T> T convert(Map<String, Object> manifest, Class<T> type) {
        try {
            return client.getKubernetesSerialization().convertValue(manifest, type);
        } catch (IllegalArgumentException e) {
            throw new ClusterOperationException("convert " + type.getSimpleName(), 0, false,
                "manifest does not describe a " + type.getSimpleName(), e);
        }
    }
    
    private <T> T call(String operation, Supplier<T> call) {
        try {
            T result = circuitBreakers.execute(CircuitBreakerManager.KUBERNETES, call);
            log.debug("{} succeeded", operation);
            return result;
        } catch (CallNotPermittedException e) {
            throw new ClusterOperationException(operation, 0, true, "circuit breaker open", e);
        } catch (KubernetesClientException e) {
            throw new ClusterOperationException(operation, e.getCode(), isRetryable(e.getCode()), e.getMessage(), e);
        }
    }
    
    /**
     * Code 0 means the request never got a response.
     */
    static boolean isRetryable(int statusCode) {
        return statusCode == 0
            || statusCode == 408
            || statusCode == 409
            || statusCode == 429
            || statusCode >= 500;
    }
}
