package com.hanyahunya.sandbox.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "sandbox", name = "deployment", havingValue = "docker", matchIfMissing = true)
public class DockerConfig {

    @Bean
    public DockerClient dockerClient(
            @Value("${sandbox.docker.host:}") String dockerHost,
            @Value("${sandbox.docker.max-connections:50}") int maxConnections,
            @Value("${sandbox.docker.response-timeout:10m}") Duration responseTimeout
    ) {
        DefaultDockerClientConfig config = clientConfig(dockerHost);

        // 이미지 pull 이 응답을 오래 붙잡으므로 response timeout 은 길게
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(maxConnections)
                .connectionTimeout(Duration.ofSeconds(10))
                .responseTimeout(responseTimeout)
                .build();

        log.info("Sandbox backend: docker at {} (maxConnections={}, responseTimeout={})",
                config.getDockerHost(), maxConnections, responseTimeout);
        return DockerClientImpl.getInstance(config, httpClient);
    }

    static DefaultDockerClientConfig clientConfig(String dockerHost) {
        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        // 비어있으면 DOCKER_HOST 환경변수, 없으면 로컬 소켓
        if (dockerHost != null && !dockerHost.isBlank()) {
            builder.withDockerHost(dockerHost);
        }
        return builder.build();
    }
}
