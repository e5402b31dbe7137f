package com.hanyahunya.sandbox.domain.exception;

import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.error.SandboxErrorCode;

public class PortExhaustedException extends BusinessException {
    public PortExhaustedException(int low, int high) {
        super(SandboxErrorCode.PORT_EXHAUSTED,
                "All ports in range [" + low + ", " + high + "] are occupied",
                "low", low,
                "high", high);
    }
}
