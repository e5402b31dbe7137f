package com.hanyahunya.sandbox.application.port.in;

import com.hanyahunya.sandbox.domain.model.ResourceLimits;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import com.hanyahunya.sandbox.domain.model.SecurityLevel;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public interface SandboxTypeUseCase {

    SandboxType register(RegisterCommand command);

    List<SandboxType> listTypes();

    record RegisterCommand(
            String name,
            String image,
            SecurityLevel securityLevel,
            Duration timeout,
            Map<String, String> environment,
            String description,
            ResourceLimits resourceLimits,
            boolean privileged
    ) {}
}
