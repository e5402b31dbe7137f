package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import com.hanyahunya.sandbox.domain.model.SecurityLevel;

public record SandboxTypeResponse(
        @JsonProperty("name")
        String name,
        @JsonProperty("image")
        String image,
        @JsonProperty("security_level")
        SecurityLevel securityLevel,
        @JsonProperty("timeout_seconds")
        long timeoutSeconds,
        @JsonProperty("description")
        String description
) {
    public static SandboxTypeResponse from(SandboxType type) {
        return new SandboxTypeResponse(
                type.name(), type.image(), type.securityLevel(), type.timeout().toSeconds(), type.description()
        );
    }
}
