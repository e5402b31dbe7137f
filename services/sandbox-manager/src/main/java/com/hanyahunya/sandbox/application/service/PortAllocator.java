package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.application.port.out.SharedStatePort;
import com.hanyahunya.sandbox.domain.exception.PortExhaustedException;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties.PortRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntPredicate;

/**
 * Hands out host ports from the configured range. The shared store is the
 * source of truth: a port belongs to whoever reserved it there first.
 */
@Slf4j
@Component
public class PortAllocator {

    private final SharedStatePort sharedStatePort;
    private final PortRange range;
    private final IntPredicate hostPortFree;

    public PortAllocator(SharedStatePort sharedStatePort, SandboxManagerProperties properties) {
        this(sharedStatePort, properties.portRange(),
                properties.checkHostPorts() ? PortAllocator::isBindable : port -> true);
    }

    PortAllocator(SharedStatePort sharedStatePort, PortRange range, IntPredicate hostPortFree) {
        this.sharedStatePort = sharedStatePort;
        this.range = range;
        this.hostPortFree = hostPortFree;
    }

    /**
     * Reserves a free port.
     *
     * @throws PortExhaustedException every port in the range is reserved
     */
    public int acquire() {
        int size = range.size();
        // 워커 간 경합을 줄이기 위해 랜덤 오프셋부터 스캔
        int offset = ThreadLocalRandom.current().nextInt(size);
        Set<Integer> known = sharedStatePort.reservedPorts();

        for (int i = 0; i < size; i++) {
            int port = range.low() + (offset + i) % size;
            if (known.contains(port)) continue;
            if (!sharedStatePort.tryReservePort(port)) continue;

            if (hostPortFree.test(port)) {
                log.debug("Reserved port {}", port);
                return port;
            }
            // 다른 프로세스가 이미 바인딩한 포트 -> 예약 즉시 취소
            log.debug("Port {} is bound on the host, skipping", port);
            sharedStatePort.releasePort(port);
        }
        throw new PortExhaustedException(range.low(), range.high());
    }

    public void release(int port) {
        sharedStatePort.releasePort(port);
        log.debug("Released port {}", port);
    }

    static boolean isBindable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
