package com.hanyahunya.sandbox.adapter.out.memory;

import com.hanyahunya.sandbox.application.port.out.SharedStatePort;
import com.hanyahunya.sandbox.domain.model.InstanceRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

/**
 * Single-process substitute for the Redis store. Only valid with one worker.
 */
@Component
@ConditionalOnProperty(prefix = "sandbox.redis", name = "enabled", havingValue = "false", matchIfMissing = true)
public class InMemorySharedStateAdapter implements SharedStatePort {

    private final Clock clock;

    // 포트 집합은 mutex로 보호
    private final Set<Integer> ports = new HashSet<>();
    private final Map<String, InstanceRecord> instances = new ConcurrentHashMap<>();
    private final Map<String, Deque<String>> pools = new ConcurrentHashMap<>();
    private final Map<String, Long> heartbeats = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessions = new ConcurrentHashMap<>();

    public InMemorySharedStateAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryReservePort(int port) {
        synchronized (ports) {
            return ports.add(port);
        }
    }

    @Override
    public void releasePort(int port) {
        synchronized (ports) {
            ports.remove(port);
        }
    }

    @Override
    public Set<Integer> reservedPorts() {
        synchronized (ports) {
            return Set.copyOf(ports);
        }
    }

    @Override
    public void saveInstance(InstanceRecord record) {
        instances.put(record.id(), record);
    }

    @Override
    public boolean updateInstance(InstanceRecord record) {
        return instances.replace(record.id(), record) != null;
    }

    @Override
    public boolean touchInstance(String id, long lastActivityAt) {
        InstanceRecord touched = instances.computeIfPresent(id, (k, current) ->
                current.lastActivityAt() >= lastActivityAt ? current : current.withActivity(lastActivityAt));
        return touched != null;
    }

    @Override
    public Optional<InstanceRecord> findInstance(String id) {
        return Optional.ofNullable(instances.get(id));
    }

    @Override
    public boolean removeInstance(String id) {
        return instances.remove(id) != null;
    }

    @Override
    public List<InstanceRecord> listInstances() {
        return new ArrayList<>(instances.values());
    }

    @Override
    public void addToPool(String type, String id) {
        pools.computeIfAbsent(type, k -> new ConcurrentLinkedDeque<>()).addLast(id);
    }

    @Override
    public void removeFromPool(String type, String id) {
        Deque<String> pool = pools.get(type);
        if (pool != null) pool.remove(id);
    }

    @Override
    public long poolSize(String type) {
        Deque<String> pool = pools.get(type);
        return pool == null ? 0 : pool.size();
    }

    @Override
    public void bindSession(String sessionId, String sandboxId) {
        sessions.compute(sessionId, (k, ids) -> {
            Set<String> bound = ids == null ? ConcurrentHashMap.newKeySet() : ids;
            bound.add(sandboxId);
            return bound;
        });
    }

    @Override
    public void unbindSession(String sessionId, String sandboxId) {
        // 비면 세션 키 자체를 제거
        sessions.computeIfPresent(sessionId, (k, ids) -> {
            ids.remove(sandboxId);
            return ids.isEmpty() ? null : ids;
        });
    }

    @Override
    public Set<String> sessionSandboxes(String sessionId) {
        Set<String> ids = sessions.get(sessionId);
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    @Override
    public Set<String> sessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    @Override
    public void sendHeartbeat(String nodeId, Duration ttl) {
        heartbeats.put(nodeId, clock.millis() + ttl.toMillis());
    }

    @Override
    public Set<String> activeNodes() {
        long now = clock.millis();
        return heartbeats.entrySet().stream()
                .filter(entry -> entry.getValue() > now)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }
}
