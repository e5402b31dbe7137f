package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;
import lombok.Getter;

@Getter
public class UnknownSandboxTypeException extends BusinessException {
    private final String sandboxType;

    public UnknownSandboxTypeException(String sandboxType) {
        super(SandboxErrorCode.UNKNOWN_SANDBOX_TYPE, "Unknown sandbox type: " + sandboxType);
        this.sandboxType = sandboxType;
    }
}
