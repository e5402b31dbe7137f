package com.hanyahunya.sandbox.domain.model;

import java.time.Instant;

public record SandboxHandle(
        String id,
        String baseUrl,
        String bearerToken,
        Instant expiresAt
) {}
