package com.hanyahunya.sandbox.domain.model;

import java.time.Duration;
import java.time.Instant;

public record SandboxStatus(
        String id,
        String type,
        SandboxState state,
        String ownerNodeId,
        String baseUrl,
        Integer port,
        Instant createdAt,
        Instant lastActivityAt,
        Instant expiresAt,
        Duration age,
        String sessionId
) {
    public static SandboxStatus of(SandboxInstance instance, String ownerNodeId, Instant now) {
        return new SandboxStatus(
                instance.getId(), instance.getType(), instance.getState(), ownerNodeId,
                instance.getBaseUrl(), instance.getPort(),
                instance.getCreatedAt(), instance.getLastActivityAt(), instance.getExpiresAt(),
                Duration.between(instance.getCreatedAt(), now),
                instance.getSessionId()
        );
    }

    public static SandboxStatus of(InstanceRecord record, Instant now) {
        Instant createdAt = Instant.ofEpochMilli(record.createdAt());
        return new SandboxStatus(
                record.id(), record.type(), record.state(), record.ownerNodeId(),
                record.baseUrl(), record.port(),
                createdAt,
                Instant.ofEpochMilli(record.lastActivityAt()),
                record.expiresAt() == 0L ? null : Instant.ofEpochMilli(record.expiresAt()),
                Duration.between(createdAt, now),
                record.sessionId()
        );
    }

    // 공유 저장소 장애 시: 존재 여부를 확정할 수 없음
    public static SandboxStatus unknown(String id) {
        return new SandboxStatus(id, null, SandboxState.UNKNOWN, null, null, null, null, null, null, null, null);
    }
}
