package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.application.port.in.SandboxTypeUseCase;
import com.hanyahunya.sandbox.domain.exception.InvalidSandboxTypeException;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class SandboxTypeService implements SandboxTypeUseCase {

    private final SandboxTypeRegistry registry;

    @Override
    public SandboxType register(RegisterCommand command) {
        SandboxType type = new SandboxType(
                command.name(),
                command.image(),
                command.securityLevel(),
                command.timeout(),
                command.environment(),
                command.description(),
                command.resourceLimits(),
                command.privileged(),
                null
        );
        if (!registry.register(type)) {
            throw new InvalidSandboxTypeException("Invalid sandbox type registration: " + command.name());
        }
        return type;
    }

    @Override
    public List<SandboxType> listTypes() {
        return registry.all();
    }
}
