package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hanyahunya.sandbox.application.port.in.SandboxTypeUseCase;
import com.hanyahunya.sandbox.domain.model.ResourceLimits;
import com.hanyahunya.sandbox.domain.model.SecurityLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.util.Map;

public record RegisterSandboxTypeRequest(
        @NotBlank
        @Pattern(regexp = "^[a-zA-Z0-9_-]+$", message = "타입 이름은 영문, 숫자, _, - 만 가능합니다.")
        @JsonProperty("name")
        String name,

        @NotBlank
        @JsonProperty("image")
        String image,

        @JsonProperty("security_level")
        SecurityLevel securityLevel,

        @Positive
        @JsonProperty("timeout_seconds")
        Long timeoutSeconds,

        @JsonProperty("environment")
        Map<String, String> environment,

        @JsonProperty("description")
        String description,

        @JsonProperty("memory_mb")
        Long memoryMb,

        @JsonProperty("cpus")
        Double cpus,

        @JsonProperty("privileged")
        boolean privileged
) {
    public SandboxTypeUseCase.RegisterCommand toCommand() {
        return new SandboxTypeUseCase.RegisterCommand(
                name,
                image,
                securityLevel,
                timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds),
                environment,
                description,
                new ResourceLimits(memoryMb, cpus, null),
                privileged
        );
    }
}
