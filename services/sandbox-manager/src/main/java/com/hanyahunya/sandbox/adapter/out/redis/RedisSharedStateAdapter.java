package com.hanyahunya.sandbox.adapter.out.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hanyahunya.sandbox.application.port.out.SharedStatePort;
import com.hanyahunya.sandbox.domain.exception.SharedStateException;
import com.hanyahunya.sandbox.domain.model.InstanceRecord;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Redis-backed shared state. Port reservation relies on {@code SADD} returning 1 for
 * exactly one caller; record removal on {@code DEL} returning 1 for exactly one caller.
 * Updates of existing records never recreate a record removed in the meantime:
 * owners write with {@code SET XX}, activity from other workers goes through
 * {@code WATCH}/{@code MULTI}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sandbox.redis", name = "enabled", havingValue = "true")
public class RedisSharedStateAdapter implements SharedStatePort {

    private static final int TOUCH_ATTEMPTS = 5;

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    private final String portsKey;
    private final String poolKeyPrefix;
    private final String instanceKeyPrefix;
    private final String instancesKey;
    private final String heartbeatPrefix;
    private final String sessionKeyPrefix;

    public RedisSharedStateAdapter(StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper,
                                   SandboxManagerProperties properties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;

        String ns = properties.redis().namespace();
        this.portsKey = ns + ":ports";
        this.poolKeyPrefix = ns + ":pool:";
        this.instanceKeyPrefix = ns + ":instance:";
        this.instancesKey = ns + ":instances";
        this.heartbeatPrefix = ns + ":node:";
        this.sessionKeyPrefix = ns + ":session:";
    }

    @PostConstruct
    public void verifyConnection() {
        String pong = execute("ping", () -> stringRedisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
        log.info("Connected to Redis shared state ({})", pong);
    }

    @Override
    public boolean tryReservePort(int port) {
        Long added = execute("reserve port", () -> stringRedisTemplate.opsForSet().add(portsKey, String.valueOf(port)));
        return added != null && added == 1L;
    }

    @Override
    public void releasePort(int port) {
        execute("release port", () -> stringRedisTemplate.opsForSet().remove(portsKey, String.valueOf(port)));
    }

    @Override
    public Set<Integer> reservedPorts() {
        Set<String> members = execute("read ports", () -> stringRedisTemplate.opsForSet().members(portsKey));
        if (members == null) return Collections.emptySet();
        return members.stream()
                .map(Integer::valueOf)
                .collect(Collectors.toSet());
    }

    @Override
    public void saveInstance(InstanceRecord record) {
        String json = toJson(record);
        execute("save instance", () -> {
            stringRedisTemplate.opsForValue().set(instanceKeyPrefix + record.id(), json);
            return stringRedisTemplate.opsForSet().add(instancesKey, record.id());
        });
    }

    @Override
    public boolean updateInstance(InstanceRecord record) {
        String json = toJson(record);
        Boolean written = execute("update instance",
                () -> stringRedisTemplate.opsForValue().setIfPresent(instanceKeyPrefix + record.id(), json));
        return Boolean.TRUE.equals(written);
    }

    @Override
    public boolean touchInstance(String id, long lastActivityAt) {
        String key = instanceKeyPrefix + id;
        for (int attempt = 0; attempt < TOUCH_ATTEMPTS; attempt++) {
            Optional<Boolean> outcome = execute("touch instance",
                    () -> stringRedisTemplate.execute(new ActivityUpdate(key, lastActivityAt)));
            if (outcome != null && outcome.isPresent()) {
                return outcome.get();
            }
            log.debug("Touch of sandbox [{}] raced with another update, retrying", id);
        }
        throw new SharedStateException("Touch of instance " + id + " kept conflicting with concurrent updates", null);
    }

    @Override
    public Optional<InstanceRecord> findInstance(String id) {
        String json = execute("find instance", () -> stringRedisTemplate.opsForValue().get(instanceKeyPrefix + id));
        return Optional.ofNullable(json).map(this::fromJson);
    }

    @Override
    public boolean removeInstance(String id) {
        Boolean deleted = execute("remove instance", () -> {
            Boolean result = stringRedisTemplate.delete(instanceKeyPrefix + id);
            stringRedisTemplate.opsForSet().remove(instancesKey, id);
            return result;
        });
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public List<InstanceRecord> listInstances() {
        Set<String> ids = execute("list instances", () -> stringRedisTemplate.opsForSet().members(instancesKey));
        if (ids == null || ids.isEmpty()) return List.of();

        List<String> orderedIds = new ArrayList<>(ids);
        List<String> keys = orderedIds.stream().map(id -> instanceKeyPrefix + id).toList();
        List<String> values = execute("list instances", () -> stringRedisTemplate.opsForValue().multiGet(keys));
        if (values == null) return List.of();

        List<InstanceRecord> records = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            String json = values.get(i);
            if (json == null) {
                // 레코드는 지워졌는데 인덱스에 남은 id 정리
                String staleId = orderedIds.get(i);
                execute("prune instance index", () -> stringRedisTemplate.opsForSet().remove(instancesKey, staleId));
                continue;
            }
            records.add(fromJson(json));
        }
        return records;
    }

    @Override
    public void addToPool(String type, String id) {
        execute("add to pool", () -> stringRedisTemplate.opsForList().rightPush(poolKeyPrefix + type, id));
    }

    @Override
    public void removeFromPool(String type, String id) {
        execute("remove from pool", () -> stringRedisTemplate.opsForList().remove(poolKeyPrefix + type, 0, id));
    }

    @Override
    public long poolSize(String type) {
        Long size = execute("pool size", () -> stringRedisTemplate.opsForList().size(poolKeyPrefix + type));
        return size == null ? 0 : size;
    }

    @Override
    public void bindSession(String sessionId, String sandboxId) {
        execute("bind session", () -> stringRedisTemplate.opsForSet().add(sessionKeyPrefix + sessionId, sandboxId));
    }

    @Override
    public void unbindSession(String sessionId, String sandboxId) {
        // 마지막 멤버가 빠지면 Redis가 키를 지움
        execute("unbind session", () -> stringRedisTemplate.opsForSet().remove(sessionKeyPrefix + sessionId, sandboxId));
    }

    @Override
    public Set<String> sessionSandboxes(String sessionId) {
        Set<String> ids = execute("read session", () -> stringRedisTemplate.opsForSet().members(sessionKeyPrefix + sessionId));
        return ids == null ? Collections.emptySet() : ids;
    }

    @Override
    public Set<String> sessionIds() {
        return stripPrefix(execute("list sessions", () -> stringRedisTemplate.keys(sessionKeyPrefix + "*")), sessionKeyPrefix);
    }

    @Override
    public void sendHeartbeat(String nodeId, Duration ttl) {
        execute("heartbeat", () -> {
            stringRedisTemplate.opsForValue().set(heartbeatPrefix + nodeId, "alive", ttl);
            return null;
        });
    }

    @Override
    public Set<String> activeNodes() {
        return stripPrefix(execute("active nodes", () -> stringRedisTemplate.keys(heartbeatPrefix + "*")), heartbeatPrefix);
    }

    private static Set<String> stripPrefix(Set<String> keys, String prefix) {
        if (keys == null) return Collections.emptySet();
        return keys.stream()
                .filter(Objects::nonNull)
                .map(k -> k.substring(prefix.length()))
                .collect(Collectors.toSet());
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new SharedStateException("Redis " + operation + " failed", e);
        }
    }

    private String toJson(InstanceRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new SharedStateException("Failed to serialize instance record " + record.id(), e);
        }
    }

    private InstanceRecord fromJson(String json) {
        try {
            return objectMapper.readValue(json, InstanceRecord.class);
        } catch (JsonProcessingException e) {
            throw new SharedStateException("Corrupted instance record: " + json, e);
        }
    }

    /**
     * Raises {@code lastActivityAt} of an existing record under {@code WATCH}.
     * Yields {@code false} when the record is gone and empty when another client
     * modified it before {@code EXEC}.
     */
    private final class ActivityUpdate implements SessionCallback<Optional<Boolean>> {

        private final String key;
        private final long lastActivityAt;

        private ActivityUpdate(String key, long lastActivityAt) {
            this.key = key;
            this.lastActivityAt = lastActivityAt;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> Optional<Boolean> execute(RedisOperations<K, V> operations) {
            RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
            ops.watch(key);
            String json = ops.opsForValue().get(key);
            if (json == null) {
                ops.unwatch();
                return Optional.of(false);
            }
            InstanceRecord current = fromJson(json);
            if (current.lastActivityAt() >= lastActivityAt) {
                ops.unwatch();
                return Optional.of(true);
            }

            ops.multi();
            ops.opsForValue().set(key, toJson(current.withActivity(lastActivityAt)));
            List<Object> results = ops.exec();
            return results == null || results.isEmpty() ? Optional.empty() : Optional.of(true);
        }
    }
}
