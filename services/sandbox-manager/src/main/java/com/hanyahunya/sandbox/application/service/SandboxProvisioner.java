package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.application.port.out.SandboxBackendPort;
import com.hanyahunya.sandbox.application.port.out.SharedStatePort;
import com.hanyahunya.sandbox.application.port.out.WorkspaceStoragePort;
import com.hanyahunya.sandbox.common.exception.BusinessException;
import com.hanyahunya.sandbox.domain.exception.ProvisioningException;
import com.hanyahunya.sandbox.domain.model.BackendHandle;
import com.hanyahunya.sandbox.domain.model.ContainerRequest;
import com.hanyahunya.sandbox.domain.model.ContainerSpec;
import com.hanyahunya.sandbox.domain.model.InstanceRecord;
import com.hanyahunya.sandbox.domain.model.NodeIdentity;
import com.hanyahunya.sandbox.domain.model.SandboxInstance;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Creates and destroys single sandbox instances: port reservation, workspace,
 * backend container and the shared-store record, rolled back together on failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SandboxProvisioner {

    public static final String LABEL_SANDBOX_ID = "sandbox.id";
    public static final String LABEL_SANDBOX_TYPE = "sandbox.type";
    public static final String LABEL_OWNER_NODE = "sandbox.owner";

    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();

    private final SandboxBackendPort backendPort;
    private final PortAllocator portAllocator;
    private final SharedStatePort sharedStatePort;
    private final WorkspaceStoragePort workspaceStoragePort;
    private final SandboxManagerProperties properties;
    private final NodeIdentity nodeIdentity;
    private final Clock clock;

    /**
     * Creates and starts one instance of {@code type} in state {@code WARM}.
     *
     * @throws com.hanyahunya.sandbox.domain.exception.PortExhaustedException no port left in the range
     * @throws ProvisioningException the backend could not create or start the container
     */
    public SandboxInstance provision(SandboxType type) {
        String id = UUID.randomUUID().toString().replace("-", "");
        String token = newToken();

        int port = portAllocator.acquire();
        BackendHandle handle = null;
        Path workspaceDir = null;

        try {
            // 1. 워크스페이스 준비 (저장소 -> 마운트 디렉토리)
            workspaceDir = prepareWorkspace(id);
            String storagePath = storagePathFor(id);
            if (workspaceDir != null && storagePath != null) {
                workspaceStoragePort.downloadFolder(storagePath, workspaceDir);
            }

            // 2. 컨테이너 생성 및 실행
            ContainerSpec spec = type.containerSpec(new ContainerRequest(
                    properties.containerPrefix() + id,
                    port,
                    properties.containerPort(),
                    token,
                    workspaceDir == null ? null : workspaceDir.toString(),
                    properties.readonlyMounts(),
                    Map.of(LABEL_SANDBOX_ID, id,
                            LABEL_SANDBOX_TYPE, type.name(),
                            LABEL_OWNER_NODE, nodeIdentity.nodeId())
            ));
            handle = backendPort.create(spec);
            backendPort.start(handle);
            if (!backendPort.isAlive(handle)) {
                throw new ProvisioningException("Sandbox container is not running after start: " + handle.name());
            }

            // 3. 공유 저장소에 등록
            SandboxInstance instance = new SandboxInstance(
                    id, type.name(), type.image(), handle, port,
                    "http://" + handle.endpointHost() + ":" + port,
                    token,
                    workspaceDir == null ? null : workspaceDir.toString(),
                    storagePath,
                    clock.instant()
            );
            sharedStatePort.saveInstance(instance.toRecord(nodeIdentity.nodeId()));

            log.info("Provisioned sandbox [{}] type={} port={} container={}", id, type.name(), port, handle.name());
            return instance;

        } catch (BusinessException e) {
            log.error("Provisioning failed for type [{}]: {}", type.name(), e.getMessage());
            rollback(id, handle, port, workspaceDir);
            throw e;
        } catch (RuntimeException e) {
            log.error("Provisioning failed for type [{}]", type.name(), e);
            rollback(id, handle, port, workspaceDir);
            throw new ProvisioningException("Failed to provision sandbox of type " + type.name(), e);
        }
    }

    /**
     * Tears an instance down: shared record, container, workspace, then the port.
     * Every step is attempted even if an earlier one fails. When another worker already
     * removed the shared record it also tore the container down and freed the port, so
     * only the local state is dropped.
     *
     * @return {@code true} if every step succeeded
     */
    public boolean destroy(SandboxInstance instance) {
        if (instance.isDestroyed()) return true;
        instance.markDestroyed();
        unbindSession(instance.getSessionId(), instance.getId());

        RecordClaim claim = claimRecord(instance.getId());
        if (claim == RecordClaim.TAKEN) {
            log.info("Sandbox [{}] was already released by another worker, dropping local state", instance.getId());
            return true;
        }

        boolean clean = claim == RecordClaim.CLAIMED;
        clean &= destroyBackend(instance.getBackendHandle());
        clean &= archiveWorkspace(instance.getWorkspaceDir(), instance.getStoragePath(), true);
        clean &= releasePort(instance.getPort());

        log.info("Destroyed sandbox [{}] type={} port={}", instance.getId(), instance.getType(), instance.getPort());
        return clean;
    }

    /**
     * Marks a local instance destroyed after another worker released it. Nothing
     * external is touched: the container and the port belong to whoever released it.
     */
    public void forget(SandboxInstance instance) {
        if (instance.isDestroyed()) return;
        instance.markDestroyed();
        unbindSession(instance.getSessionId(), instance.getId());
        log.info("Sandbox [{}] was released by another worker, dropping local state", instance.getId());
    }

    /**
     * Tears down an instance known only through its shared record (owned by a peer or a dead node).
     * Only the caller that removes the record performs the teardown.
     *
     * @return {@code false} if another caller already claimed the record
     */
    public boolean destroyRecord(InstanceRecord record) {
        if (!sharedStatePort.removeInstance(record.id())) {
            log.debug("Sandbox [{}] already released by another worker", record.id());
            return false;
        }
        unbindSession(record.sessionId(), record.id());
        destroyBackend(record.backendHandle());
        if (record.workspaceDir() != null && Files.isDirectory(Paths.get(record.workspaceDir()))) {
            archiveWorkspace(record.workspaceDir(), record.storagePath(), true);
        }
        releasePort(record.port());

        log.info("Destroyed sandbox [{}] owned by node {} port={}", record.id(), record.ownerNodeId(), record.port());
        return true;
    }

    public boolean resume(BackendHandle handle) {
        backendPort.start(handle);
        return backendPort.isAlive(handle);
    }

    public boolean pause(BackendHandle handle) {
        backendPort.stop(handle);
        return !backendPort.isAlive(handle);
    }

    /**
     * Prepares a released instance for another caller: its workspace is archived and
     * wiped, and the container must still be running.
     *
     * @return {@code false} if the instance cannot be reused and should be destroyed
     */
    public boolean resetForReuse(SandboxInstance instance) {
        if (!archiveWorkspace(instance.getWorkspaceDir(), instance.getStoragePath(), false)) {
            return false;
        }
        return isAlive(instance);
    }

    public String nodeId() {
        return nodeIdentity.nodeId();
    }

    public boolean isAlive(SandboxInstance instance) {
        try {
            return backendPort.isAlive(instance.getBackendHandle());
        } catch (RuntimeException e) {
            log.warn("Liveness check failed for sandbox [{}]: {}", instance.getId(), e.getMessage());
            return false;
        }
    }

    private Path prepareWorkspace(String id) {
        if (!properties.workspaceEnabled()) return null;
        Path dir = Paths.get(properties.defaultMountDir(), id).toAbsolutePath();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ProvisioningException("Failed to create workspace directory " + dir, e);
        }
        return dir;
    }

    private String storagePathFor(String id) {
        if (!properties.workspaceEnabled()) return null;
        return workspaceStoragePort.pathJoin(properties.storageFolder(), id);
    }

    // 워크스페이스 업로드 후 삭제(destroy) 또는 비우기(recycle)
    private boolean archiveWorkspace(String workspaceDir, String storagePath, boolean deleteDir) {
        if (workspaceDir == null) return true;
        Path dir = Paths.get(workspaceDir);
        try {
            if (storagePath != null && Files.isDirectory(dir)) {
                workspaceStoragePort.uploadFolder(dir, storagePath);
            }
            if (deleteDir) {
                FileSystemUtils.deleteRecursively(dir);
            } else {
                wipe(dir);
            }
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Workspace cleanup failed: {}", dir, e);
            return false;
        }
    }

    private void wipe(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return;
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                FileSystemUtils.deleteRecursively(child);
            }
        }
    }

    private enum RecordClaim { CLAIMED, TAKEN, UNKNOWN }

    // 레코드를 지운 쪽만 포트를 반환한다. 저장소 장애 시에는 직접 정리 (UNKNOWN)
    private RecordClaim claimRecord(String id) {
        try {
            return sharedStatePort.removeInstance(id) ? RecordClaim.CLAIMED : RecordClaim.TAKEN;
        } catch (RuntimeException e) {
            log.warn("Failed to remove shared record of sandbox [{}]: {}", id, e.getMessage());
            return RecordClaim.UNKNOWN;
        }
    }

    void unbindSession(String sessionId, String sandboxId) {
        if (sessionId == null) return;
        try {
            sharedStatePort.unbindSession(sessionId, sandboxId);
        } catch (RuntimeException e) {
            log.warn("Failed to unbind sandbox [{}] from session {}: {}", sandboxId, sessionId, e.getMessage());
        }
    }

    private boolean removeRecord(String id) {
        try {
            sharedStatePort.removeInstance(id);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to remove shared record of sandbox [{}]: {}", id, e.getMessage());
            return false;
        }
    }

    private boolean destroyBackend(BackendHandle handle) {
        if (handle == null) return true;
        boolean clean = true;
        try {
            backendPort.stop(handle);
        } catch (RuntimeException e) {
            log.warn("Backend stop failed: {}", handle.name(), e);
            clean = false;
        }
        try {
            backendPort.destroy(handle);
        } catch (RuntimeException e) {
            log.error("Backend destroy failed: {}", handle.name(), e);
            clean = false;
        }
        return clean;
    }

    // 컨테이너가 사라진 뒤에 포트 반환
    private boolean releasePort(int port) {
        try {
            portAllocator.release(port);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to release port {} (left for orphan reclaim)", port, e);
            return false;
        }
    }

    private void rollback(String id, BackendHandle handle, int port, Path workspaceDir) {
        destroyBackend(handle);
        removeRecord(id);
        if (workspaceDir != null) {
            try {
                FileSystemUtils.deleteRecursively(workspaceDir);
            } catch (IOException e) {
                log.warn("Failed to delete workspace {}", workspaceDir, e);
            }
        }
        releasePort(port);
    }

    private static String newToken() {
        byte[] bytes = new byte[16];
        TOKEN_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
