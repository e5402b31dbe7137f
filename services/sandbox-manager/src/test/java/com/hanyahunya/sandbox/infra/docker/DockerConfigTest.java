package com.hanyahunya.sandbox.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DockerConfigTest {

    @Test
    void configuredHostOverridesEnvironmentDefault() {
        DefaultDockerClientConfig config = DockerConfig.clientConfig("tcp://10.0.0.5:2375");

        assertEquals(URI.create("tcp://10.0.0.5:2375"), config.getDockerHost());
    }

    @Test
    void blankHostFallsBackToDefaultResolution() {
        DefaultDockerClientConfig config = DockerConfig.clientConfig("  ");

        assertNotNull(config.getDockerHost());
    }

    @Test
    void clientIsBuiltWithoutContactingTheDaemon() throws Exception {
        DockerClient client = new DockerConfig().dockerClient("tcp://127.0.0.1:1", 4, Duration.ofSeconds(5));

        assertNotNull(client);
        client.close();
    }
}
