package com.hanyahunya.sandbox.adapter.in.web;

import com.hanyahunya.sandbox.adapter.in.web.dto.RegisterSandboxTypeRequest;
import com.hanyahunya.sandbox.adapter.in.web.dto.SandboxTypeResponse;
import com.hanyahunya.sandbox.application.port.in.SandboxTypeUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/sandbox-types")
@RequiredArgsConstructor
public class SandboxTypeController {

    private final SandboxTypeUseCase sandboxTypeUseCase;

    @GetMapping
    public ResponseEntity<List<SandboxTypeResponse>> listTypes() {
        return ResponseEntity.ok(
                sandboxTypeUseCase.listTypes().stream().map(SandboxTypeResponse::from).toList()
        );
    }

    @PostMapping
    public ResponseEntity<SandboxTypeResponse> register(@Valid @RequestBody RegisterSandboxTypeRequest request) {
        return ResponseEntity.ok(SandboxTypeResponse.from(sandboxTypeUseCase.register(request.toCommand())));
    }
}
