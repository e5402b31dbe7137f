package com.hanyahunya.sandbox.application.system;

import com.hanyahunya.sandbox.application.service.SandboxLifecycleService;
import com.hanyahunya.sandbox.application.service.SandboxPool;
import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Background upkeep, each task on its own schedule: pool fill, idle sweep and
 * reclamation of instances left behind by dead nodes.
 */
@Slf4j
@Service
@EnableScheduling
@RequiredArgsConstructor
public class SandboxMaintenanceService {

    // 주인 노드가 사라진 뒤 3분 유예
    static final Duration ORPHAN_GRACE = Duration.ofMinutes(3);

    private final SandboxPool pool;
    private final SandboxLifecycleService lifecycleService;
    private final SandboxManagerProperties properties;

    @Scheduled(initialDelay = 0, fixedDelayString = "${sandbox.maintenance.fill-interval-ms:5000}")
    public void fillPools() {
        if (lifecycleService.isShuttingDown()) return;

        for (String type : properties.pooledTypes()) {
            try {
                pool.fill(type);
            } catch (RuntimeException e) {
                log.error("Pool fill task failed for [{}]", type, e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${sandbox.maintenance.sweep-interval-ms:30000}")
    public void sweepIdle() {
        if (lifecycleService.isShuttingDown()) return;

        try {
            int released = lifecycleService.sweep(properties.maxIdle());
            if (released > 0) {
                log.info("Idle sweep released {} sandboxes", released);
            }
        } catch (RuntimeException e) {
            log.error("Idle sweep failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${sandbox.maintenance.orphan-interval-ms:60000}")
    public void reclaimOrphans() {
        if (lifecycleService.isShuttingDown()) return;

        try {
            int reclaimed = lifecycleService.reclaimOrphans(ORPHAN_GRACE);
            if (reclaimed > 0) {
                log.info("Reclaimed {} orphaned sandboxes", reclaimed);
            }
        } catch (RuntimeException e) {
            log.error("Orphan reclaim failed", e);
        }
    }
}
