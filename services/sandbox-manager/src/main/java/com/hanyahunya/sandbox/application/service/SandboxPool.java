package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.application.port.out.SharedStatePort;
import com.hanyahunya.sandbox.domain.model.SandboxInstance;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-type FIFO of warm, unassigned instances.
 * <p>
 * Each type has a slot counter covering warm instances plus creations in flight, reserved by
 * CAS before any backend call, so the bound holds without holding a lock across backend work.
 */
@Slf4j
@Component
public class SandboxPool {

    private final SandboxProvisioner provisioner;
    private final SandboxTypeRegistry registry;
    private final SharedStatePort sharedStatePort;
    private final SandboxManagerProperties properties;
    private final Clock clock;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public SandboxPool(SandboxProvisioner provisioner, SandboxTypeRegistry registry, SharedStatePort sharedStatePort,
                       SandboxManagerProperties properties, Clock clock) {
        this.provisioner = provisioner;
        this.registry = registry;
        this.sharedStatePort = sharedStatePort;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Tops up the warm instances of {@code typeName} up to its capacity.
     * Stops at the first failed creation; the next call retries.
     *
     * @return number of instances created
     */
    public int fill(String typeName) {
        int capacity = properties.poolSizeFor(typeName);
        if (closed || capacity <= 0) return 0;

        Bucket bucket = bucket(typeName);
        if (bucket.backoffTicks.get() > 0) {
            int remaining = bucket.backoffTicks.decrementAndGet();
            log.debug("Pool fill for [{}] backing off ({} ticks left)", typeName, remaining);
            return 0;
        }

        Optional<SandboxType> type = registry.find(typeName);
        if (type.isEmpty()) {
            log.warn("Pool configured for unknown sandbox type [{}]", typeName);
            return 0;
        }

        int created = 0;
        while (!closed && bucket.tryReserveSlot(capacity)) {
            SandboxInstance instance;
            try {
                instance = provisioner.provision(type.get());
            } catch (RuntimeException e) {
                bucket.releaseSlot();
                onFillFailure(typeName, bucket, e);
                break;
            }
            bucket.consecutiveFailures.set(0);
            offerWarm(bucket, instance);
            created++;
        }

        if (created > 0) {
            log.debug("Pool [{}] filled +{} (warm={}/{})", typeName, created, bucket.warm.size(), capacity);
        }
        return created;
    }

    /**
     * Hands out the oldest warm instance, or creates one synchronously on a miss.
     * The returned instance is still in its pool-exit state; the caller assigns it.
     */
    public SandboxInstance take(SandboxType type) {
        Bucket bucket = bucket(type.name());

        SandboxInstance instance;
        while ((instance = bucket.warm.pollFirst()) != null) {
            bucket.releaseSlot();
            removeFromSharedPool(type.name(), instance.getId());

            // [검증] 타입 재등록으로 이미지가 바뀌었거나 컨테이너가 죽은 경우 폐기
            if (!instance.getImage().equals(type.image())) {
                log.info("Discarding warm sandbox [{}]: image {} replaced by {}", instance.getId(), instance.getImage(), type.image());
                provisioner.destroy(instance);
                continue;
            }
            if (!provisioner.isAlive(instance)) {
                log.warn("Discarding warm sandbox [{}]: container is not running", instance.getId());
                provisioner.destroy(instance);
                continue;
            }

            log.debug("Pool hit [{}] -> {}", type.name(), instance.getId());
            return instance;
        }

        log.debug("Pool miss [{}], creating synchronously", type.name());
        return provisioner.provision(type);
    }

    /**
     * Returns an instance released by its caller. With {@code recycle} and room in the pool the
     * instance is reset and goes back to warm; otherwise it is destroyed.
     */
    public void giveBack(SandboxInstance instance, boolean recycle) {
        if (instance.isDestroyed()) return;

        if (recycle && !closed) {
            Bucket bucket = bucket(instance.getType());
            if (bucket.tryReserveSlot(properties.poolSizeFor(instance.getType()))) {
                if (isReusable(instance) && provisioner.resetForReuse(instance)) {
                    provisioner.unbindSession(instance.getSessionId(), instance.getId());
                    instance.markWarm(clock.instant());
                    if (!publishWarm(instance)) {
                        bucket.releaseSlot();
                        provisioner.forget(instance);
                        return;
                    }
                    offerWarm(bucket, instance);
                    log.info("Recycled sandbox [{}] into pool [{}]", instance.getId(), instance.getType());
                    return;
                }
                bucket.releaseSlot();
            }
        }
        provisioner.destroy(instance);
    }

    /**
     * Stops further fills and removes every warm instance. The caller destroys what is returned.
     */
    public List<SandboxInstance> close() {
        closed = true;
        List<SandboxInstance> drained = new ArrayList<>();
        buckets.forEach((type, bucket) -> {
            SandboxInstance instance;
            while ((instance = bucket.warm.pollFirst()) != null) {
                bucket.releaseSlot();
                removeFromSharedPool(type, instance.getId());
                drained.add(instance);
            }
        });
        return drained;
    }

    /**
     * Removes and destroys all warm instances.
     *
     * @return number of instances destroyed
     */
    public int drain() {
        List<SandboxInstance> drained = close();
        drained.forEach(provisioner::destroy);
        return drained.size();
    }

    public Optional<SandboxInstance> findWarm(String id) {
        return buckets.values().stream()
                .flatMap(bucket -> bucket.warm.stream())
                .filter(instance -> instance.getId().equals(id))
                .findFirst();
    }

    public int warmCount(String typeName) {
        Bucket bucket = buckets.get(typeName);
        return bucket == null ? 0 : bucket.warm.size();
    }

    public boolean isClosed() {
        return closed;
    }

    private boolean isReusable(SandboxInstance instance) {
        return registry.find(instance.getType())
                .map(type -> type.image().equals(instance.getImage()))
                .orElse(false);
    }

    private void offerWarm(Bucket bucket, SandboxInstance instance) {
        bucket.warm.addLast(instance);
        addToSharedPool(instance.getType(), instance.getId());

        // close()와 경합: 이미 닫혔다면 직접 회수
        if (closed && bucket.warm.remove(instance)) {
            bucket.releaseSlot();
            removeFromSharedPool(instance.getType(), instance.getId());
            provisioner.destroy(instance);
        }
    }

    private void onFillFailure(String typeName, Bucket bucket, RuntimeException e) {
        int failures = bucket.consecutiveFailures.incrementAndGet();
        int limit = properties.fillRetryLimit();
        log.error("Pool fill failed for [{}] (consecutive failures: {})", typeName, failures, e);
        if (limit > 0 && failures >= limit) {
            log.warn("Pool fill for [{}] failed {} times in a row, skipping the next {} ticks", typeName, failures, limit);
            bucket.consecutiveFailures.set(0);
            bucket.backoffTicks.set(limit);
        }
    }

    // 레코드가 이미 지워졌으면(다른 워커가 해제) false
    private boolean publishWarm(SandboxInstance instance) {
        try {
            return sharedStatePort.updateInstance(instance.toRecord(provisioner.nodeId()));
        } catch (RuntimeException e) {
            log.warn("Failed to update shared record of sandbox [{}]: {}", instance.getId(), e.getMessage());
            return true;
        }
    }

    private void addToSharedPool(String type, String id) {
        try {
            sharedStatePort.addToPool(type, id);
        } catch (RuntimeException e) {
            log.warn("Failed to publish warm sandbox [{}] to shared pool view: {}", id, e.getMessage());
        }
    }

    private void removeFromSharedPool(String type, String id) {
        try {
            sharedStatePort.removeFromPool(type, id);
        } catch (RuntimeException e) {
            log.warn("Failed to remove sandbox [{}] from shared pool view: {}", id, e.getMessage());
        }
    }

    private Bucket bucket(String typeName) {
        return buckets.computeIfAbsent(typeName, k -> new Bucket());
    }

    private static final class Bucket {
        private final Deque<SandboxInstance> warm = new ConcurrentLinkedDeque<>();
        // warm + 생성 중(in-flight)
        private final AtomicInteger slots = new AtomicInteger();
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicInteger backoffTicks = new AtomicInteger();

        boolean tryReserveSlot(int capacity) {
            while (true) {
                int current = slots.get();
                if (current >= capacity) return false;
                if (slots.compareAndSet(current, current + 1)) return true;
            }
        }

        void releaseSlot() {
            slots.decrementAndGet();
        }
    }
}
