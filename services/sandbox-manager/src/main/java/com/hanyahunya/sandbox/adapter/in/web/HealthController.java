package com.hanyahunya.sandbox.adapter.in.web;

import com.hanyahunya.sandbox.adapter.in.web.dto.HealthResponse;
import com.hanyahunya.sandbox.application.service.SandboxLifecycleService;
import com.hanyahunya.sandbox.domain.model.NodeIdentity;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SandboxLifecycleService lifecycleService;
    private final SandboxManagerProperties properties;
    private final NodeIdentity nodeIdentity;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        String status = lifecycleService.isShuttingDown() ? "shutting_down" : "ok";
        return ResponseEntity.ok(new HealthResponse(
                status, properties.defaultType(), nodeIdentity.nodeId(), lifecycleService.assignedCount(),
                lifecycleService.sharedPoolSizes()
        ));
    }
}
