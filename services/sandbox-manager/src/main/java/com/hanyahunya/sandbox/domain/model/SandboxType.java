package com.hanyahunya.sandbox.domain.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * A registered kind of sandbox: which image to run and how.
 */
public record SandboxType(
        String name,
        String image,
        SecurityLevel securityLevel,
        Duration timeout,
        Map<String, String> environment,
        String description,
        ResourceLimits resourceLimits,
        boolean privileged,
        ContainerSpecFactory specFactory
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    public SandboxType {
        name = name == null ? null : name.trim().toLowerCase(Locale.ROOT);
        securityLevel = securityLevel == null ? SecurityLevel.MEDIUM : securityLevel;
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        description = description == null ? "" : description;
        resourceLimits = resourceLimits == null ? ResourceLimits.NONE : resourceLimits;
        specFactory = specFactory == null ? ContainerSpecFactory.DEFAULT : specFactory;
    }

    public static SandboxType of(String name, String image, SecurityLevel securityLevel, Duration timeout, String description) {
        return new SandboxType(name, image, securityLevel, timeout, Map.of(), description, null, false, null);
    }

    public ContainerSpec containerSpec(ContainerRequest request) {
        return specFactory.build(this, request);
    }
}
