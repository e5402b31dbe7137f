package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.application.port.in.SandboxLifecycleUseCase;
import com.hanyahunya.sandbox.application.port.out.SharedStatePort;
import com.hanyahunya.sandbox.domain.exception.SandboxNotFoundException;
import com.hanyahunya.sandbox.domain.exception.SharedStateException;
import com.hanyahunya.sandbox.domain.exception.ShuttingDownException;
import com.hanyahunya.sandbox.domain.model.BackendHandle;
import com.hanyahunya.sandbox.domain.model.InstanceRecord;
import com.hanyahunya.sandbox.domain.model.NodeIdentity;
import com.hanyahunya.sandbox.domain.model.SandboxHandle;
import com.hanyahunya.sandbox.domain.model.SandboxInstance;
import com.hanyahunya.sandbox.domain.model.SandboxState;
import com.hanyahunya.sandbox.domain.model.SandboxStatus;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
@RequiredArgsConstructor
public class SandboxLifecycleService implements SandboxLifecycleUseCase {

    private final SandboxTypeRegistry registry;
    private final SandboxPool pool;
    private final SandboxProvisioner provisioner;
    private final SharedStatePort sharedStatePort;
    private final SandboxManagerProperties properties;
    private final NodeIdentity nodeIdentity;
    private final Clock clock;

    // 이 프로세스가 호출자에게 내준 인스턴스
    private final Map<String, SandboxInstance> assigned = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Override
    public SandboxHandle acquire(AcquireCommand command) {
        if (shuttingDown.get()) {
            throw new ShuttingDownException();
        }

        String typeName = command.sandboxType() == null ? properties.defaultType() : command.sandboxType();
        // 타입 검증이 먼저: 알 수 없는 타입이면 포트를 잡지 않는다
        SandboxType type = registry.require(typeName);

        Duration timeout = command.timeout() == null ? type.timeout() : command.timeout();
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }

        SandboxInstance instance = pool.take(type);
        Instant now = clock.instant();
        instance.assign(now, now.plus(timeout), command.sessionId());
        assigned.put(instance.getId(), instance);

        try {
            sharedStatePort.saveInstance(instance.toRecord(nodeIdentity.nodeId()));
            if (command.sessionId() != null) {
                sharedStatePort.bindSession(command.sessionId(), instance.getId());
            }
        } catch (SharedStateException e) {
            assigned.remove(instance.getId());
            provisioner.destroy(instance);
            throw e;
        }

        // 생성 도중 shutdown()이 스냅샷을 떴다면 여기서 직접 정리
        if (shuttingDown.get()) {
            if (assigned.remove(instance.getId(), instance)) {
                log.info("Shutdown started while acquiring sandbox [{}], destroying it", instance.getId());
                provisioner.destroy(instance);
            }
            throw new ShuttingDownException();
        }

        log.info("Acquired sandbox [{}] type={} expiresAt={}", instance.getId(), type.name(), instance.getExpiresAt());
        return instance.toHandle();
    }

    @Override
    public void release(String sandboxId) {
        release(sandboxId, properties.autoCleanup());
    }

    @Override
    public void release(String sandboxId, boolean recycle) {
        if (sandboxId == null) return;

        SandboxInstance local = assigned.remove(sandboxId);
        if (local != null) {
            log.info("Releasing sandbox [{}] (recycle={})", sandboxId, recycle);
            pool.giveBack(local, recycle && !shuttingDown.get());
            return;
        }

        // 다른 워커 소유 인스턴스
        Optional<InstanceRecord> record = sharedStatePort.findInstance(sandboxId);
        if (record.isEmpty()) {
            log.debug("Release of unknown or already released sandbox [{}] ignored", sandboxId);
            return;
        }
        InstanceRecord found = record.get();
        if (nodeIdentity.nodeId().equals(found.ownerNodeId()) || found.state() != SandboxState.ASSIGNED) {
            // 내 warm 인스턴스이거나 다른 워커의 풀 소속: 호출자에게 할당된 적 없음
            log.debug("Sandbox [{}] is not assigned ({}), release ignored", sandboxId, found.state());
            return;
        }

        log.info("Releasing sandbox [{}] owned by node {}", sandboxId, found.ownerNodeId());
        provisioner.destroyRecord(found);
    }

    @Override
    public SandboxStatus inspect(String sandboxId) {
        Instant now = clock.instant();

        SandboxInstance local = assigned.get(sandboxId);
        if (local != null && releasedByPeer(local)) {
            if (assigned.remove(sandboxId, local)) {
                provisioner.forget(local);
            }
            throw new SandboxNotFoundException(sandboxId);
        }
        if (local == null) {
            local = pool.findWarm(sandboxId).orElse(null);
        }
        if (local != null) {
            return SandboxStatus.of(local, nodeIdentity.nodeId(), now);
        }

        try {
            return sharedStatePort.findInstance(sandboxId)
                    .map(record -> SandboxStatus.of(record, now))
                    .orElseThrow(() -> new SandboxNotFoundException(sandboxId));
        } catch (SharedStateException e) {
            log.warn("Shared state unavailable while inspecting sandbox [{}]: {}", sandboxId, e.getMessage());
            return SandboxStatus.unknown(sandboxId);
        }
    }

    @Override
    public void touch(String sandboxId) {
        Instant now = clock.instant();

        SandboxInstance local = assigned.get(sandboxId);
        if (local != null) {
            local.touch(now);
            boolean recorded;
            try {
                recorded = sharedStatePort.touchInstance(sandboxId, now.toEpochMilli());
            } catch (SharedStateException e) {
                log.warn("Failed to publish activity of sandbox [{}]: {}", sandboxId, e.getMessage());
                return;
            }
            if (!recorded) {
                // 다른 워커가 이미 해제
                if (assigned.remove(sandboxId, local)) {
                    provisioner.forget(local);
                }
                throw new SandboxNotFoundException(sandboxId);
            }
            return;
        }

        // 다른 워커 소유: 활동 시각만 갱신, 그 사이 삭제됐으면 되살리지 않음
        sharedStatePort.findInstance(sandboxId)
                .filter(found -> found.state() == SandboxState.ASSIGNED)
                .orElseThrow(() -> new SandboxNotFoundException(sandboxId));
        if (!sharedStatePort.touchInstance(sandboxId, now.toEpochMilli())) {
            throw new SandboxNotFoundException(sandboxId);
        }
    }

    @Override
    public boolean start(String sandboxId) {
        BackendHandle handle = assignedHandle(sandboxId);
        boolean running = provisioner.resume(handle);
        if (running) {
            log.info("Started sandbox [{}]", sandboxId);
        } else {
            log.error("Sandbox [{}] is not running after start ({})", sandboxId, handle.name());
        }
        return running;
    }

    @Override
    public boolean stop(String sandboxId) {
        BackendHandle handle = assignedHandle(sandboxId);
        boolean stopped = provisioner.pause(handle);
        if (stopped) {
            log.info("Stopped sandbox [{}]", sandboxId);
        } else {
            log.error("Sandbox [{}] is still running after stop ({})", sandboxId, handle.name());
        }
        return stopped;
    }

    @Override
    public List<String> sessionSandboxes(String sessionId) {
        return sharedStatePort.sessionSandboxes(sessionId).stream().sorted().toList();
    }

    @Override
    public List<String> sessionIds() {
        return sharedStatePort.sessionIds().stream().sorted().toList();
    }

    /**
     * Warm instances per pooled type as published by every worker. A type whose count
     * cannot be read is reported as {@code -1}.
     */
    public Map<String, Long> sharedPoolSizes() {
        Map<String, Long> sizes = new TreeMap<>();
        for (String type : properties.pooledTypes()) {
            try {
                sizes.put(type, sharedStatePort.poolSize(type));
            } catch (SharedStateException e) {
                log.debug("Shared pool size of [{}] unavailable: {}", type, e.getMessage());
                sizes.put(type, -1L);
            }
        }
        return sizes;
    }

    @Override
    public List<SandboxStatus> list() {
        Instant now = clock.instant();
        try {
            return sharedStatePort.listInstances().stream()
                    .map(record -> SandboxStatus.of(record, now))
                    .toList();
        } catch (SharedStateException e) {
            log.warn("Shared state unavailable, listing local sandboxes only: {}", e.getMessage());
            return assigned.values().stream()
                    .map(instance -> SandboxStatus.of(instance, nodeIdentity.nodeId(), now))
                    .toList();
        }
    }

    /**
     * Destroys every assigned instance idle for longer than {@code maxIdle} or past its expiry.
     * Activity recorded by other workers through the shared store counts as activity.
     *
     * @return number of instances released
     */
    public int sweep(Duration maxIdle) {
        Instant now = clock.instant();
        int released = 0;

        for (SandboxInstance instance : List.copyOf(assigned.values())) {
            Optional<InstanceRecord> shared;
            try {
                shared = sharedStatePort.findInstance(instance.getId());
            } catch (SharedStateException e) {
                log.debug("Using local activity for sandbox [{}]: {}", instance.getId(), e.getMessage());
                shared = Optional.of(instance.toRecord(nodeIdentity.nodeId()));
            }
            if (shared.isEmpty()) {
                if (assigned.remove(instance.getId(), instance)) {
                    provisioner.forget(instance);
                }
                continue;
            }

            Instant expiresAt = instance.getExpiresAt();
            boolean expired = expiresAt != null && now.isAfter(expiresAt);
            boolean idle = Duration.between(latestActivity(instance, shared.get()), now).compareTo(maxIdle) > 0;
            if (!expired && !idle) continue;

            if (assigned.remove(instance.getId(), instance)) {
                log.info("Sweeping sandbox [{}] ({})", instance.getId(), expired ? "expired" : "idle");
                pool.giveBack(instance, false);
                released++;
            }
        }
        return released;
    }

    /**
     * Destroys instances whose owning node stopped heart-beating, once {@code grace}
     * has passed since their last activity or expiry.
     *
     * @return number of instances reclaimed
     */
    public int reclaimOrphans(Duration grace) {
        long now = clock.millis();
        Set<String> liveNodes = sharedStatePort.activeNodes();
        int reclaimed = 0;

        for (InstanceRecord record : sharedStatePort.listInstances()) {
            String owner = record.ownerNodeId();
            if (nodeIdentity.nodeId().equals(owner) || liveNodes.contains(owner)) continue;

            long lastSeen = Math.max(record.lastActivityAt(), record.expiresAt());
            if (now - lastSeen <= grace.toMillis()) {
                // [Case C] 주인이 죽은 지 얼마 안 됨: 유예
                log.debug("Waiting for grace period of orphan sandbox [{}] (owner {})", record.id(), owner);
                continue;
            }

            log.warn("Reclaiming orphaned sandbox [{}] (owner {} is gone)", record.id(), owner);
            try {
                if (provisioner.destroyRecord(record)) reclaimed++;
            } catch (RuntimeException e) {
                log.error("Failed to reclaim orphaned sandbox [{}]", record.id(), e);
            }
        }
        return reclaimed;
    }

    /**
     * Stops accepting acquires and, with auto-cleanup, destroys every instance this
     * process owns within the configured grace period.
     *
     * @return number of instances destroyed in time
     */
    public int shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) return 0;

        if (!properties.autoCleanup()) {
            log.info("Shutting down without cleanup, leaving {} assigned sandboxes", assigned.size());
            pool.close();
            return 0;
        }

        List<SandboxInstance> victims = new ArrayList<>(pool.close());
        // 제거에 성공한 쪽이 정리 책임을 가짐 (진행 중인 acquire와 경합)
        for (String id : List.copyOf(assigned.keySet())) {
            SandboxInstance instance = assigned.remove(id);
            if (instance != null) victims.add(instance);
        }
        if (victims.isEmpty()) return 0;

        log.info("Shutting down: destroying {} sandboxes", victims.size());
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(victims.size(), 8), r -> {
            Thread t = new Thread(r, "sandbox-shutdown");
            t.setDaemon(true);
            return t;
        });

        AtomicInteger destroyed = new AtomicInteger();
        Map<String, Future<?>> tasks = new ConcurrentHashMap<>();
        for (SandboxInstance instance : victims) {
            tasks.put(instance.getId(), executor.submit(() -> {
                provisioner.destroy(instance);
                destroyed.incrementAndGet();
            }));
        }
        executor.shutdown();

        try {
            if (!executor.awaitTermination(properties.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                List<String> abandoned = tasks.entrySet().stream()
                        .filter(entry -> !entry.getValue().isDone())
                        .map(Map.Entry::getKey)
                        .toList();
                log.error("Shutdown grace of {} exceeded, abandoning sandboxes {}", properties.shutdownGrace(), abandoned);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while destroying sandboxes on shutdown");
            executor.shutdownNow();
        }

        log.info("Shutdown complete: {}/{} sandboxes destroyed", destroyed.get(), victims.size());
        return destroyed.get();
    }

    @PreDestroy
    public void onContextClose() {
        shutdown();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public int assignedCount() {
        return assigned.size();
    }

    private Instant latestActivity(SandboxInstance instance, InstanceRecord shared) {
        Instant local = instance.getLastActivityAt();
        Instant remote = Instant.ofEpochMilli(shared.lastActivityAt());
        return remote.isAfter(local) ? remote : local;
    }

    // 공유 레코드가 사라졌으면 다른 워커가 해제한 것. 저장소 장애 시에는 판단 보류
    private boolean releasedByPeer(SandboxInstance instance) {
        try {
            return sharedStatePort.findInstance(instance.getId()).isEmpty();
        } catch (SharedStateException e) {
            log.debug("Cannot verify shared record of sandbox [{}]: {}", instance.getId(), e.getMessage());
            return false;
        }
    }

    private BackendHandle assignedHandle(String sandboxId) {
        SandboxInstance local = assigned.get(sandboxId);
        if (local != null && !local.isDestroyed()) {
            return local.getBackendHandle();
        }
        return sharedStatePort.findInstance(sandboxId)
                .filter(record -> record.state() == SandboxState.ASSIGNED)
                .map(InstanceRecord::backendHandle)
                .orElseThrow(() -> new SandboxNotFoundException(sandboxId));
    }
}
