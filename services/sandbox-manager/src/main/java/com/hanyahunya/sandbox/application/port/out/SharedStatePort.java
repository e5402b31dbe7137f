package com.hanyahunya.sandbox.application.port.out;

import com.hanyahunya.sandbox.domain.model.InstanceRecord;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * State shared by every worker process: port reservations, instance records,
 * warm pool membership and node heartbeats.
 * <p>
 * Store failures are reported as {@code SharedStateException}.
 */
public interface SharedStatePort {

    // [Port] 원자적 예약 - 이번 호출이 예약에 성공했을 때만 true
    boolean tryReservePort(int port);

    // [Port] 예약 해제 (이미 비어있으면 no-op)
    void releasePort(int port);

    Set<Integer> reservedPorts();

    // [Instance]
    void saveInstance(InstanceRecord record);

    // [Instance] 레코드가 남아있을 때만 덮어쓰기 - 이미 삭제됐으면 false
    boolean updateInstance(InstanceRecord record);

    // [Instance] lastActivityAt 만 원자적으로 갱신 (다른 필드는 소유 워커의 값 유지)
    boolean touchInstance(String id, long lastActivityAt);

    Optional<InstanceRecord> findInstance(String id);

    // [Instance] 원자적 삭제 - 실제로 삭제한 호출자만 true
    boolean removeInstance(String id);

    List<InstanceRecord> listInstances();

    // [Pool] warm 인스턴스 id 목록 (관측용)
    void addToPool(String type, String id);

    void removeFromPool(String type, String id);

    long poolSize(String type);

    // [Session] 세션 컨텍스트 -> 샌드박스 id 집합
    void bindSession(String sessionId, String sandboxId);

    void unbindSession(String sessionId, String sandboxId);

    Set<String> sessionSandboxes(String sessionId);

    Set<String> sessionIds();

    // [Heartbeat]
    void sendHeartbeat(String nodeId, Duration ttl);

    // [Cluster View] 현재 살아있는 모든 노드 조회
    Set<String> activeNodes();
}
