package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;

public class ProvisioningException extends BusinessException {
    public ProvisioningException(String message) {
        super(SandboxErrorCode.PROVISIONING_FAILED, message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(SandboxErrorCode.PROVISIONING_FAILED, message, cause);
    }
}
