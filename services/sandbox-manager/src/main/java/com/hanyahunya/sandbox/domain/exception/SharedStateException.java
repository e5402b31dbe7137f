package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;

public class SharedStateException extends BusinessException {
    public SharedStateException(String message, Throwable cause) {
        super(SandboxErrorCode.SHARED_STATE_UNAVAILABLE, message, cause);
    }
}
