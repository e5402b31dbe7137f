package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hanyahunya.sandbox.domain.model.SandboxState;
import com.hanyahunya.sandbox.domain.model.SandboxStatus;

import java.time.Instant;

public record SandboxStatusResponse(
        @JsonProperty("sandbox_id")
        String sandboxId,
        @JsonProperty("type")
        String type,
        @JsonProperty("state")
        SandboxState state,
        @JsonProperty("owner_node_id")
        String ownerNodeId,
        @JsonProperty("base_url")
        String baseUrl,
        @JsonProperty("created_at")
        Instant createdAt,
        @JsonProperty("last_activity_at")
        Instant lastActivityAt,
        @JsonProperty("expires_at")
        Instant expiresAt,
        @JsonProperty("age_seconds")
        Long ageSeconds,
        @JsonProperty("session_id")
        String sessionId
) {
    public static SandboxStatusResponse from(SandboxStatus status) {
        return new SandboxStatusResponse(
                status.id(),
                status.type(),
                status.state(),
                status.ownerNodeId(),
                status.baseUrl(),
                status.createdAt(),
                status.lastActivityAt(),
                status.expiresAt(),
                status.age() == null ? null : status.age().toSeconds(),
                status.sessionId()
        );
    }
}
