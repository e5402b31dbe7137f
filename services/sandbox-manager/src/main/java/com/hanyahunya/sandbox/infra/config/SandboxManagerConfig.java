package com.hanyahunya.sandbox.infra.config;

import com.hanyahunya.sandbox.application.service.SandboxTypeRegistry;
import com.hanyahunya.sandbox.domain.model.NodeIdentity;
import com.hanyahunya.sandbox.domain.model.ResourceLimits;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import com.hanyahunya.sandbox.domain.model.SecurityLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

@Slf4j
@Configuration
public class SandboxManagerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NodeIdentity nodeIdentity(SandboxManagerProperties properties) {
        if (properties.workers() > properties.effectiveWorkers()) {
            log.warn("Redis shared state is disabled, forcing workers {} -> {}", properties.workers(), properties.effectiveWorkers());
        }
        return new NodeIdentity(UUID.randomUUID().toString());
    }

    @Bean
    public SandboxTypeRegistry sandboxTypeRegistry(SandboxManagerProperties properties) {
        SandboxTypeRegistry registry = new SandboxTypeRegistry();
        SandboxManagerProperties.Image image = properties.image();

        // 기본 제공 타입
        registry.register(SandboxType.of("base", image.referenceFor("base"),
                SecurityLevel.MEDIUM, Duration.ofSeconds(30), "Base sandbox with shell and Python execution"));
        registry.register(SandboxType.of("filesystem", image.referenceFor("filesystem"),
                SecurityLevel.MEDIUM, Duration.ofSeconds(60), "Sandbox with file system tools"));
        registry.register(SandboxType.of("browser", image.referenceFor("browser"),
                SecurityLevel.MEDIUM, Duration.ofSeconds(60), "Sandbox with a headless browser"));
        registry.register(SandboxType.of("gui", image.referenceFor("gui"),
                SecurityLevel.HIGH, SandboxType.DEFAULT_TIMEOUT, "Sandbox with a desktop environment"));

        for (SandboxManagerProperties.CustomType custom : properties.customTypes()) {
            SandboxType type = new SandboxType(
                    custom.name(),
                    custom.image(),
                    custom.securityLevel(),
                    custom.timeout(),
                    custom.environment(),
                    custom.description(),
                    new ResourceLimits(custom.memoryMb(), custom.cpus(), null),
                    Boolean.TRUE.equals(custom.privileged()),
                    null
            );
            if (!registry.register(type)) {
                throw new IllegalStateException("Invalid custom sandbox type in configuration: " + custom.name());
            }
        }

        if (!registry.contains(properties.defaultType())) {
            throw new IllegalStateException("Default sandbox type is not registered: " + properties.defaultType());
        }
        return registry;
    }
}
