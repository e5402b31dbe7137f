package com.hanyahunya.sandbox.domain.model;

import java.util.Map;

/**
 * Per-instance parameters handed to a {@link ContainerSpecFactory}.
 */
public record ContainerRequest(
        String containerName,
        int hostPort,
        int containerPort,
        String bearerToken,
        String workspaceDir,
        Map<String, String> readonlyMounts,
        Map<String, String> labels
) {}
