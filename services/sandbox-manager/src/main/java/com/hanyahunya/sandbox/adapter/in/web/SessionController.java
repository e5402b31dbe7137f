package com.hanyahunya.sandbox.adapter.in.web;

import com.hanyahunya.sandbox.adapter.in.web.dto.SessionSandboxesResponse;
import com.hanyahunya.sandbox.application.port.in.SandboxLifecycleUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SandboxLifecycleUseCase sandboxLifecycleUseCase;

    @GetMapping
    public ResponseEntity<List<String>> list() {
        return ResponseEntity.ok(sandboxLifecycleUseCase.sessionIds());
    }

    // 알 수 없는 세션이면 빈 목록
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSandboxesResponse> sandboxes(@PathVariable String sessionId) {
        return ResponseEntity.ok(
                new SessionSandboxesResponse(sessionId, sandboxLifecycleUseCase.sessionSandboxes(sessionId))
        );
    }
}
