package com.hanyahunya.sandbox.domain.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the container spec for one instance of a sandbox type.
 * Stored in each {@link SandboxType} so custom types can shape their containers
 * without the backend knowing about them.
 */
@FunctionalInterface
public interface ContainerSpecFactory {

    String TOKEN_ENV = "SECRET_TOKEN";

    ContainerSpec build(SandboxType type, ContainerRequest request);

    ContainerSpecFactory DEFAULT = (type, request) -> {
        Map<String, String> env = new HashMap<>(type.environment());
        env.put(TOKEN_ENV, request.bearerToken());

        return new ContainerSpec(
                request.containerName(),
                type.image(),
                env,
                request.hostPort(),
                request.containerPort(),
                request.workspaceDir(),
                request.readonlyMounts(),
                type.resourceLimits(),
                type.privileged(),
                request.labels()
        );
    };
}
