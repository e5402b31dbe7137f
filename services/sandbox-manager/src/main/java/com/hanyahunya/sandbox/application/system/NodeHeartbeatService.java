package com.hanyahunya.sandbox.application.system;

import com.hanyahunya.sandbox.application.port.out.SharedStatePort;
import com.hanyahunya.sandbox.domain.model.NodeIdentity;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class NodeHeartbeatService {

    // 노드 TTL 10초, 3초마다 갱신
    static final Duration HEARTBEAT_TTL = Duration.ofSeconds(10);

    private final SharedStatePort sharedStatePort;
    private final NodeIdentity nodeIdentity;

    @PostConstruct
    public void init() {
        log.info("Sandbox Manager Node Started. ID: {}", nodeIdentity.nodeId());
        heartbeat();
    }

    @Scheduled(fixedRate = 3000)
    public void heartbeat() {
        try {
            sharedStatePort.sendHeartbeat(nodeIdentity.nodeId(), HEARTBEAT_TTL);
        } catch (RuntimeException e) {
            log.warn("Heartbeat failed for node {}: {}", nodeIdentity.nodeId(), e.getMessage());
        }
    }
}
