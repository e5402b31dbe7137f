package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SandboxRunStateResponse(
        @JsonProperty("sandbox_id")
        String sandboxId,
        @JsonProperty("running")
        boolean running
) {}
