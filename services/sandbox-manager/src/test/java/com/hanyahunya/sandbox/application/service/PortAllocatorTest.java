package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.adapter.out.memory.InMemorySharedStateAdapter;
import com.hanyahunya.sandbox.domain.exception.PortExhaustedException;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties.PortRange;
import com.hanyahunya.sandbox.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PortAllocatorTest {

    private InMemorySharedStateAdapter sharedState;

    @BeforeEach
    void setUp() {
        sharedState = new InMemorySharedStateAdapter(new MutableClock(Instant.EPOCH));
    }

    @Test
    void acquiresEveryPortInRangeOnce() {
        var allocator = new PortAllocator(sharedState, new PortRange(40000, 40004), port -> true);

        Set<Integer> ports = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            ports.add(allocator.acquire());
        }

        assertEquals(Set.of(40000, 40001, 40002, 40003, 40004), ports);
        assertEquals(ports, sharedState.reservedPorts());
        assertThrows(PortExhaustedException.class, allocator::acquire);
    }

    @Test
    void skipsPortsReservedByAnotherWorker() {
        sharedState.tryReservePort(40000);
        sharedState.tryReservePort(40001);
        var allocator = new PortAllocator(sharedState, new PortRange(40000, 40002), port -> true);

        assertEquals(40002, allocator.acquire());
    }

    @Test
    void portBoundOnHostIsSkippedAndItsReservationUndone() {
        var allocator = new PortAllocator(sharedState, new PortRange(40000, 40001), port -> port != 40000);

        assertEquals(40001, allocator.acquire());
        assertEquals(Set.of(40001), sharedState.reservedPorts());
        assertThrows(PortExhaustedException.class, allocator::acquire);
        assertEquals(Set.of(40001), sharedState.reservedPorts());
    }

    @Test
    void releasedPortCanBeAcquiredAgain() {
        var allocator = new PortAllocator(sharedState, new PortRange(40000, 40000), port -> true);

        int port = allocator.acquire();
        allocator.release(port);

        assertEquals(port, allocator.acquire());
    }

    @Test
    void exhaustionMessageNamesTheRange() {
        var allocator = new PortAllocator(sharedState, new PortRange(40000, 40000), port -> false);

        var e = assertThrows(PortExhaustedException.class, allocator::acquire);
        assertTrue(e.getMessage().contains("40000"));
    }
}
