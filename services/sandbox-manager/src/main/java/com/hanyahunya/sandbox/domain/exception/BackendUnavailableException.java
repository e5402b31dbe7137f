package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;

public class BackendUnavailableException extends BusinessException {
    public BackendUnavailableException(String message, Throwable cause) {
        super(SandboxErrorCode.BACKEND_UNAVAILABLE, message, cause);
    }
}
