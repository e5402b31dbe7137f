package com.hanyahunya.sandbox.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record HealthResponse(
        @JsonProperty("status")
        String status,
        @JsonProperty("default_type")
        String defaultType,
        @JsonProperty("node_id")
        String nodeId,
        @JsonProperty("assigned")
        int assigned,
        // 모든 워커 합산 warm 인스턴스 수 (조회 실패 시 -1)
        @JsonProperty("warm_pool")
        Map<String, Long> warmPool
) {}
