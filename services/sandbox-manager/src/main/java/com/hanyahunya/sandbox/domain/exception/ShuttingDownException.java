package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;

public class ShuttingDownException extends BusinessException {
    public ShuttingDownException() {
        super(SandboxErrorCode.SHUTTING_DOWN);
    }
}
