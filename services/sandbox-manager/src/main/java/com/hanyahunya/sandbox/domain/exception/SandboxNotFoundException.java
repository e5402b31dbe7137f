package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;
import lombok.Getter;

@Getter
public class SandboxNotFoundException extends BusinessException {
    private final String sandboxId;

    public SandboxNotFoundException(String sandboxId) {
        super(SandboxErrorCode.SANDBOX_NOT_FOUND, "No sandbox found with id: " + sandboxId);
        this.sandboxId = sandboxId;
    }
}
