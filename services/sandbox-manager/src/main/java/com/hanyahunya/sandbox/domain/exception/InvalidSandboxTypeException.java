package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;

public class InvalidSandboxTypeException extends BusinessException {
    public InvalidSandboxTypeException(String message) {
        super(SandboxErrorCode.INVALID_SANDBOX_TYPE, message);
    }
}
