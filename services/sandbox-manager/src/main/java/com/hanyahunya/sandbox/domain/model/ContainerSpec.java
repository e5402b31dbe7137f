package com.hanyahunya.sandbox.domain.model;

import java.util.Map;

public record ContainerSpec(
        String name,
        String image,
        Map<String, String> environment,
        int hostPort,
        int containerPort,
        String workspaceDir,
        Map<String, String> readonlyMounts,
        ResourceLimits resourceLimits,
        boolean privileged,
        Map<String, String> labels
) {
    public static final String WORKSPACE_MOUNT_PATH = "/workspace";

    public ContainerSpec {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        readonlyMounts = readonlyMounts == null ? Map.of() : Map.copyOf(readonlyMounts);
        resourceLimits = resourceLimits == null ? ResourceLimits.NONE : resourceLimits;
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
