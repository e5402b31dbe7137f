package com.hanyahunya.sandbox.adapter.out.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hanyahunya.sandbox.domain.exception.SharedStateException;
import com.hanyahunya.sandbox.domain.model.InstanceRecord;
import com.hanyahunya.sandbox.domain.model.SandboxState;
import com.hanyahunya.sandbox.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RedisSharedStateAdapterTest {

    private StringRedisTemplate redisTemplate;
    private SetOperations<String, String> setOps;
    private ValueOperations<String, String> valueOps;
    private ListOperations<String, String> listOps;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisSharedStateAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        setOps = mock(SetOperations.class);
        valueOps = mock(ValueOperations.class);
        listOps = mock(ListOperations.class);
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForList()).thenReturn(listOps);

        adapter = new RedisSharedStateAdapter(redisTemplate, objectMapper,
                TestProperties.builder().redisEnabled(true).workers(4).build());
    }

    @Test
    void portReservationSucceedsOnlyWhenSaddAddsTheMember() {
        when(setOps.add("test:ports", "49152")).thenReturn(1L);
        when(setOps.add("test:ports", "49153")).thenReturn(0L);

        assertTrue(adapter.tryReservePort(49152));
        assertFalse(adapter.tryReservePort(49153));
    }

    @Test
    void reservedPortsAreParsed() {
        when(setOps.members("test:ports")).thenReturn(Set.of("49152", "49160"));

        assertEquals(Set.of(49152, 49160), adapter.reservedPorts());
    }

    @Test
    void savedRecordIsStoredAsJsonAndIndexed() throws Exception {
        InstanceRecord record = record("abc");

        adapter.saveInstance(record);

        var json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("test:instance:abc"), json.capture());
        verify(setOps).add("test:instances", "abc");
        assertEquals(record, objectMapper.readValue(json.getValue(), InstanceRecord.class));
    }

    @Test
    void findReadsRecordByKey() throws Exception {
        InstanceRecord record = record("abc");
        when(valueOps.get("test:instance:abc")).thenReturn(objectMapper.writeValueAsString(record));

        assertEquals(Optional.of(record), adapter.findInstance("abc"));
        assertTrue(adapter.findInstance("missing").isEmpty());
    }

    @Test
    void corruptedRecordIsSharedStateError() {
        when(valueOps.get("test:instance:abc")).thenReturn("{not json");

        assertThrows(SharedStateException.class, () -> adapter.findInstance("abc"));
    }

    @Test
    void removeReportsWhetherThisCallerDeletedTheRecord() {
        when(redisTemplate.delete("test:instance:abc")).thenReturn(true, false);

        assertTrue(adapter.removeInstance("abc"));
        assertFalse(adapter.removeInstance("abc"));
        verify(setOps, times(2)).remove("test:instances", "abc");
    }

    @Test
    void listSkipsAndPrunesIdsWhoseRecordIsGone() throws Exception {
        when(setOps.members("test:instances")).thenReturn(new LinkedHashSet<>(List.of("a", "b")));
        when(valueOps.multiGet(List.of("test:instance:a", "test:instance:b")))
                .thenReturn(Arrays.asList(objectMapper.writeValueAsString(record("a")), null));

        List<InstanceRecord> records = adapter.listInstances();

        assertEquals(1, records.size());
        assertEquals("a", records.get(0).id());
        verify(setOps).remove("test:instances", "b");
    }

    @Test
    void poolViewUsesPerTypeList() {
        when(listOps.size("test:pool:base")).thenReturn(2L);

        adapter.addToPool("base", "abc");
        adapter.removeFromPool("base", "abc");

        verify(listOps).rightPush("test:pool:base", "abc");
        verify(listOps).remove("test:pool:base", 0, "abc");
        assertEquals(2L, adapter.poolSize("base"));
        assertEquals(0L, adapter.poolSize("browser"));
    }

    @Test
    void heartbeatExpiresWithTtlAndActiveNodesStripPrefix() {
        when(redisTemplate.keys("test:node:*")).thenReturn(Set.of("test:node:n1", "test:node:n2"));

        adapter.sendHeartbeat("n1", Duration.ofSeconds(10));

        verify(valueOps).set("test:node:n1", "alive", Duration.ofSeconds(10));
        assertEquals(Set.of("n1", "n2"), adapter.activeNodes());
    }

    @Test
    void redisFailureIsTranslated() {
        when(setOps.add("test:ports", "49152"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        var e = assertThrows(SharedStateException.class, () -> adapter.tryReservePort(49152));
        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    // ── conditional updates ───────────────────────────────────────────

    @Test
    void updateWritesOnlyWhenRecordExists() {
        when(valueOps.setIfPresent(eq("test:instance:abc"), anyString())).thenReturn(false);

        assertFalse(adapter.updateInstance(record("abc")));

        verify(valueOps, never()).set(anyString(), anyString());
        verify(setOps, never()).add("test:instances", "abc");
    }

    @Test
    void touchRaisesActivityInsideTransaction() throws Exception {
        RedisOperations<String, String> operations = transactionalOperations();
        when(valueOps.get("test:instance:abc")).thenReturn(objectMapper.writeValueAsString(record("abc")));
        when(operations.exec()).thenReturn(List.of(true));

        assertTrue(adapter.touchInstance("abc", 5_000L));

        verify(operations).watch("test:instance:abc");
        verify(operations).multi();
        var json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("test:instance:abc"), json.capture());
        InstanceRecord touched = objectMapper.readValue(json.getValue(), InstanceRecord.class);
        assertEquals(5_000L, touched.lastActivityAt());
        assertEquals(SandboxState.ASSIGNED, touched.state());
        assertEquals("node-1", touched.ownerNodeId());
    }

    @Test
    void touchOfRemovedRecordWritesNothing() {
        RedisOperations<String, String> operations = transactionalOperations();
        when(valueOps.get("test:instance:gone")).thenReturn(null);

        assertFalse(adapter.touchInstance("gone", 5_000L));

        verify(operations).unwatch();
        verify(operations, never()).multi();
        verify(valueOps, never()).set(anyString(), anyString());
    }

    @Test
    void touchRetriesWhenTransactionIsAborted() throws Exception {
        RedisOperations<String, String> operations = transactionalOperations();
        when(valueOps.get("test:instance:abc")).thenReturn(objectMapper.writeValueAsString(record("abc")));
        when(operations.exec()).thenReturn(List.of(), List.of(true));

        assertTrue(adapter.touchInstance("abc", 5_000L));

        verify(operations, times(2)).multi();
    }

    // ── sessions ──────────────────────────────────────────────────────

    @Test
    void sessionsAreSetsUnderTheNamespace() {
        when(setOps.members("test:session:ctx-1")).thenReturn(Set.of("a", "b"));
        when(redisTemplate.keys("test:session:*")).thenReturn(Set.of("test:session:ctx-1"));

        adapter.bindSession("ctx-1", "a");
        adapter.unbindSession("ctx-1", "c");

        verify(setOps).add("test:session:ctx-1", "a");
        verify(setOps).remove("test:session:ctx-1", "c");
        assertEquals(Set.of("a", "b"), adapter.sessionSandboxes("ctx-1"));
        assertEquals(Set.of("ctx-1"), adapter.sessionIds());
    }

    @SuppressWarnings("unchecked")
    private RedisOperations<String, String> transactionalOperations() {
        RedisOperations<String, String> operations = mock(RedisOperations.class);
        when(operations.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.execute(any(SessionCallback.class)))
                .thenAnswer(invocation -> invocation.getArgument(0, SessionCallback.class).execute(operations));
        return operations;
    }

    private static InstanceRecord record(String id) {
        return new InstanceRecord(id, "base", "node-1", "cid-" + id, "sandbox-" + id, "localhost",
                49152, "http://localhost:49152", SandboxState.ASSIGNED,
                1_000L, 2_000L, 31_000L, null, null, null);
    }
}
