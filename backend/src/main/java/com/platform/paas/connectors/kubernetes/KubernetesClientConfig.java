package com.platform.paas.connectors.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cluster API client. Configuration comes from the in-cluster service account
 * or the local kubeconfig, as resolved by fabric8.
 */
@Slf4j
@Configuration
public class KubernetesClientConfig {
    
    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        KubernetesClient client = new KubernetesClientBuilder().build();
        log.info("Kubernetes client configured for {}", client.getMasterUrl());
        return client;
    }
}
