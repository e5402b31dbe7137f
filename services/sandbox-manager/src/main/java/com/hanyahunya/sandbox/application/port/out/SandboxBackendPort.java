package com.hanyahunya.sandbox.application.port.out;

import com.hanyahunya.sandbox.domain.model.BackendHandle;
import com.hanyahunya.sandbox.domain.model.ContainerSpec;

/**
 * Container substrate driver. Implementations never retry internally.
 * <p>
 * Connectivity failures surface as {@code BackendUnavailableException};
 * API failures while creating or starting surface as {@code ProvisioningException}.
 */
public interface SandboxBackendPort {

    BackendHandle create(ContainerSpec spec);

    void start(BackendHandle handle);

    void stop(BackendHandle handle);

    // 이미 없으면 no-op
    void destroy(BackendHandle handle);

    boolean isAlive(BackendHandle handle);
}
