package com.hanyahunya.sandbox.application.port.in;

import com.hanyahunya.sandbox.domain.model.SandboxHandle;
import com.hanyahunya.sandbox.domain.model.SandboxStatus;

import java.time.Duration;
import java.util.List;

public interface SandboxLifecycleUseCase {

    SandboxHandle acquire(AcquireCommand command);

    void release(String sandboxId);

    void release(String sandboxId, boolean recycle);

    SandboxStatus inspect(String sandboxId);

    void touch(String sandboxId);

    List<SandboxStatus> list();

    /**
     * Resumes the container of an assigned sandbox.
     *
     * @return {@code true} if the container is running afterwards
     */
    boolean start(String sandboxId);

    /**
     * Pauses the container of an assigned sandbox. Its port and workspace stay reserved.
     *
     * @return {@code true} if the container is stopped afterwards
     */
    boolean stop(String sandboxId);

    // 세션 컨텍스트에 묶인 샌드박스 id
    List<String> sessionSandboxes(String sessionId);

    List<String> sessionIds();

    /**
     * @param sandboxType type id; {@code null} selects the configured default type
     * @param timeout     lifetime of the assignment; {@code null} uses the type's default
     * @param sessionId   optional caller session the sandbox is bound to until released
     */
    record AcquireCommand(
            String sandboxType,
            Duration timeout,
            String sessionId
    ) {
        public AcquireCommand(String sandboxType, Duration timeout) {
            this(sandboxType, timeout, null);
        }
    }
}
