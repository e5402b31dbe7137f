package com.hanyahunya.sandbox.domain.error;

import com.hanyahunya.sandbox.common.error.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum SandboxErrorCode implements ErrorCode {

    UNKNOWN_SANDBOX_TYPE(HttpStatus.BAD_REQUEST, "S-001", "등록되지 않은 샌드박스 타입입니다."),
    INVALID_SANDBOX_TYPE(HttpStatus.BAD_REQUEST, "S-002", "샌드박스 타입 등록 정보가 올바르지 않습니다."),
    SANDBOX_NOT_FOUND(HttpStatus.NOT_FOUND, "S-003", "존재하지 않는 샌드박스입니다."),
    PROVISIONING_FAILED(HttpStatus.BAD_GATEWAY, "S-004", "샌드박스 컨테이너 생성에 실패했습니다."),
    PORT_EXHAUSTED(HttpStatus.SERVICE_UNAVAILABLE, "S-005", "할당 가능한 포트가 없습니다. 잠시 후 다시 시도해주세요."),
    BACKEND_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "S-006", "컨테이너 백엔드에 연결할 수 없습니다."),
    SHARED_STATE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "S-007", "공유 상태 저장소에 연결할 수 없습니다."),
    SHUTTING_DOWN(HttpStatus.SERVICE_UNAVAILABLE, "S-008", "서버가 종료 중입니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
