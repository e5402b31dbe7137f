package com.hanyahunya.sandbox.adapter.in.web;

import com.hanyahunya.sandbox.adapter.in.web.dto.AcquireSandboxRequest;
import com.hanyahunya.sandbox.adapter.in.web.dto.SandboxHandleResponse;
import com.hanyahunya.sandbox.adapter.in.web.dto.SandboxRunStateResponse;
import com.hanyahunya.sandbox.adapter.in.web.dto.SandboxStatusResponse;
import com.hanyahunya.sandbox.application.port.in.SandboxLifecycleUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/sandboxes")
@RequiredArgsConstructor
public class SandboxController {

    private final SandboxLifecycleUseCase sandboxLifecycleUseCase;

    @PostMapping
    public ResponseEntity<SandboxHandleResponse> acquire(@Valid @RequestBody AcquireSandboxRequest request) {
        return ResponseEntity.ok(
                SandboxHandleResponse.from(sandboxLifecycleUseCase.acquire(request.toCommand()))
        );
    }

    @GetMapping
    public ResponseEntity<List<SandboxStatusResponse>> list() {
        return ResponseEntity.ok(
                sandboxLifecycleUseCase.list().stream().map(SandboxStatusResponse::from).toList()
        );
    }

    @GetMapping("/{sandboxId}")
    public ResponseEntity<SandboxStatusResponse> inspect(@PathVariable String sandboxId) {
        return ResponseEntity.ok(SandboxStatusResponse.from(sandboxLifecycleUseCase.inspect(sandboxId)));
    }

    @PostMapping("/{sandboxId}/touch")
    public ResponseEntity<Void> touch(@PathVariable String sandboxId) {
        sandboxLifecycleUseCase.touch(sandboxId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sandboxId}/start")
    public ResponseEntity<SandboxRunStateResponse> start(@PathVariable String sandboxId) {
        return ResponseEntity.ok(new SandboxRunStateResponse(sandboxId, sandboxLifecycleUseCase.start(sandboxId)));
    }

    @PostMapping("/{sandboxId}/stop")
    public ResponseEntity<SandboxRunStateResponse> stop(@PathVariable String sandboxId) {
        return ResponseEntity.ok(new SandboxRunStateResponse(sandboxId, !sandboxLifecycleUseCase.stop(sandboxId)));
    }

    // recycle 미지정 시 auto-cleanup 설정을 따름
    @DeleteMapping("/{sandboxId}")
    public ResponseEntity<Void> release(
            @PathVariable String sandboxId,
            @RequestParam(required = false) Boolean recycle
    ) {
        if (recycle == null) {
            sandboxLifecycleUseCase.release(sandboxId);
        } else {
            sandboxLifecycleUseCase.release(sandboxId, recycle);
        }
        return ResponseEntity.noContent().build();
    }
}
