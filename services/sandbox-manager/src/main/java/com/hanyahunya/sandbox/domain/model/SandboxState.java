package com.hanyahunya.sandbox.domain.model;

public enum SandboxState {
    WARM,
    ASSIGNED,
    DESTROYED,
    // 공유 저장소 조회 실패 시 (inspect degrade)
    UNKNOWN
}
