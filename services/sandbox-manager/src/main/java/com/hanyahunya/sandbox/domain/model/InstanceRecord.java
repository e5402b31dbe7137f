package com.hanyahunya.sandbox.domain.model;

/**
 * Shared-store view of a sandbox instance, serialized as JSON under {@code {ns}:instance:{id}}.
 * Timestamps are epoch millis; {@code expiresAt == 0} means "no expiry" (warm instances).
 */
public record InstanceRecord(
        String id,
        String type,
        String ownerNodeId,
        String backendId,
        String backendName,
        String endpointHost,
        int port,
        String baseUrl,
        SandboxState state,
        long createdAt,
        long lastActivityAt,
        long expiresAt,
        String workspaceDir,
        String storagePath,
        String sessionId
) {
    public BackendHandle backendHandle() {
        return new BackendHandle(backendId, backendName, endpointHost);
    }

    public InstanceRecord withActivity(long lastActivityAt) {
        return new InstanceRecord(id, type, ownerNodeId, backendId, backendName, endpointHost, port, baseUrl,
                state, createdAt, lastActivityAt, expiresAt, workspaceDir, storagePath, sessionId);
    }
}
