package com.hanyahunya.sandbox.adapter.in.web.error;

import com.hanyahunya.sandbox.common.error.ErrorCode;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

@Getter
@Builder
public class ErrorResponse {
    private final int status;
    private final String code;
    private final String message;

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return ErrorResponse.builder()
                .status(errorCode.getHttpStatus().value())
                .code(errorCode.getCode())
                .message(message)
                .build();
    }

    // ErrorCode를 받아서 ErrorResponse 객체를 만드는 메서드
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return toResponseEntity(errorCode, errorCode.getMessage());
    }

    // 메시지 커스텀 오버로딩 메서드
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String customMessage) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(errorCode.getHttpStatus());
        // 일시적 장애(503)는 재시도 가능
        if (errorCode.isRetryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, "5");
        }
        return builder.body(of(errorCode, customMessage));
    }
}
