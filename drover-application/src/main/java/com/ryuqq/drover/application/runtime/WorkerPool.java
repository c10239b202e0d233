package com.ryuqq.drover.application.runtime;

import com.ryuqq.drover.application.claim.ClaimRegistry;

/**
 * Task를 실행하는 Worker 집합.
 *
 * <p>구현체는 시작 시 정해진 수의 Worker를 띄우고, 각 Worker는 {@link ClaimRegistry}에서
 * Task를 선점해 실행한 뒤 결과를 {@link EventChannel}로 정확히 한 번 보고합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkerPool {

    /**
     * Worker 시작 (한 번만 호출 가능).
     *
     * @param claimRegistry 선점 레지스트리
     * @param eventChannel 결과 보고 채널
     * @throws IllegalStateException 이미 시작된 경우
     */
    void start(ClaimRegistry claimRegistry, EventChannel eventChannel);

    /**
     * 모든 Worker와 진행 중인 실행을 즉시 취소.
     *
     * <p>결과를 기다리지 않으며, 취소된 실행의 이벤트는 보고되지 않습니다. 멱등.</p>
     */
    void shutdownNow();

    /**
     * 아직 은퇴하지 않은 Worker 수.
     *
     * @return 활성 Worker 수
     */
    int activeWorkers();
}
