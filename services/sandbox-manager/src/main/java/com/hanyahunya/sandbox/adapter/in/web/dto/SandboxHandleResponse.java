package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hanyahunya.sandbox.domain.model.SandboxHandle;

import java.time.Instant;

public record SandboxHandleResponse(
        @JsonProperty("sandbox_id")
        String sandboxId,
        @JsonProperty("base_url")
        String baseUrl,
        @JsonProperty("bearer_token")
        String bearerToken,
        @JsonProperty("expires_at")
        Instant expiresAt
) {
    public static SandboxHandleResponse from(SandboxHandle handle) {
        return new SandboxHandleResponse(handle.id(), handle.baseUrl(), handle.bearerToken(), handle.expiresAt());
    }
}
