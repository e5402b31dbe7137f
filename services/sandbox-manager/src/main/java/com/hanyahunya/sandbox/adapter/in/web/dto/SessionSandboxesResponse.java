package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SessionSandboxesResponse(
        @JsonProperty("session_id")
        String sessionId,
        @JsonProperty("sandbox_ids")
        List<String> sandboxIds
) {}
