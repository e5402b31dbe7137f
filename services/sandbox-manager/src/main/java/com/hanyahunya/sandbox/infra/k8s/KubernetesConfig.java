package com.hanyahunya.sandbox.infra.k8s;

import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "sandbox", name = "deployment", havingValue = "k8s")
public class KubernetesConfig {

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient(SandboxManagerProperties properties) {
        String kubeconfigPath = properties.k8s().kubeconfigPath();
        Config config;
        if (kubeconfigPath == null || kubeconfigPath.isBlank()) {
            // in-cluster 또는 ~/.kube/config
            config = Config.autoConfigure(null);
        } else {
            try {
                config = Config.fromKubeconfig(Files.readString(Path.of(kubeconfigPath)));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read kubeconfig " + kubeconfigPath, e);
            }
        }
        config.setNamespace(properties.k8s().namespace());
        log.info("K8s: Connecting to {} (namespace {})", config.getMasterUrl(), config.getNamespace());

        return new KubernetesClientBuilder().withConfig(config).build();
    }
}
