package com.hanyahunya.sandbox.common.exception;

import com.hanyahunya.sandbox.common.error.ErrorCode;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> payload = new HashMap<>();

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /*
        사용법: new BusinessException(
            ErrorCode, "message",
            "sandboxId", id,
            "port", 49152
        )
     */
    public BusinessException(ErrorCode errorCode, String message, Object... keyValues) {
        super(message);
        this.errorCode = errorCode;

        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Key-Value pairs must be even.");
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            this.payload.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
    }
}
