package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hanyahunya.sandbox.application.port.in.SandboxLifecycleUseCase;
import jakarta.validation.constraints.Positive;

import java.time.Duration;

public record AcquireSandboxRequest(
        @JsonProperty("type")
        String type,

        @Positive(message = "timeout_seconds 는 양수여야 합니다.")
        @JsonProperty("timeout_seconds")
        Long timeoutSeconds,

        @JsonProperty("session_id")
        String sessionId
) {
    public SandboxLifecycleUseCase.AcquireCommand toCommand() {
        return new SandboxLifecycleUseCase.AcquireCommand(
                type,
                timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds),
                sessionId == null || sessionId.isBlank() ? null : sessionId
        );
    }
}
