package com.hanyahunya.sandbox.domain.model;

import lombok.Getter;

import java.time.Instant;

/**
 * A live sandbox owned by this process. Identity fields are fixed at creation;
 * state and timestamps move as the instance travels between the pool and a caller.
 */
@Getter
public class SandboxInstance {

    private final String id;
    private final String type;
    private final String image;
    private final BackendHandle backendHandle;
    private final int port;
    private final String baseUrl;
    private final String bearerToken;
    private final String workspaceDir;
    private final String storagePath;
    private final Instant createdAt;

    private volatile SandboxState state;
    private volatile Instant lastActivityAt;
    private volatile Instant expiresAt;
    private volatile String sessionId;

    public SandboxInstance(String id, String type, String image, BackendHandle backendHandle, int port,
                           String baseUrl, String bearerToken, String workspaceDir, String storagePath,
                           Instant createdAt) {
        this.id = id;
        this.type = type;
        this.image = image;
        this.backendHandle = backendHandle;
        this.port = port;
        this.baseUrl = baseUrl;
        this.bearerToken = bearerToken;
        this.workspaceDir = workspaceDir;
        this.storagePath = storagePath;
        this.createdAt = createdAt;
        this.state = SandboxState.WARM;
        this.lastActivityAt = createdAt;
    }

    public void assign(Instant now, Instant expiresAt, String sessionId) {
        this.state = SandboxState.ASSIGNED;
        this.lastActivityAt = now;
        this.expiresAt = expiresAt;
        this.sessionId = sessionId;
    }

    public void markWarm(Instant now) {
        this.state = SandboxState.WARM;
        this.lastActivityAt = now;
        this.expiresAt = null;
        this.sessionId = null;
    }

    public void markDestroyed() {
        this.state = SandboxState.DESTROYED;
    }

    public void touch(Instant now) {
        this.lastActivityAt = now;
    }

    public boolean isDestroyed() {
        return state == SandboxState.DESTROYED;
    }

    public InstanceRecord toRecord(String ownerNodeId) {
        Instant expiry = expiresAt;
        return new InstanceRecord(
                id, type, ownerNodeId,
                backendHandle.id(), backendHandle.name(), backendHandle.endpointHost(),
                port, baseUrl, state,
                createdAt.toEpochMilli(),
                lastActivityAt.toEpochMilli(),
                expiry == null ? 0L : expiry.toEpochMilli(),
                workspaceDir, storagePath, sessionId
        );
    }

    public SandboxHandle toHandle() {
        return new SandboxHandle(id, baseUrl, bearerToken, expiresAt);
    }
}
