package com.hanyahunya.sandbox.common.error;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
    HttpStatus getHttpStatus();
    String getCode();
    String getMessage();

    // 재시도해도 되는 에러인지 (클라이언트 백오프 판단용)
    default boolean isRetryable() {
        return getHttpStatus() == HttpStatus.SERVICE_UNAVAILABLE;
    }
}
