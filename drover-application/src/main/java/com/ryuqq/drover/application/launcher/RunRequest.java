package com.ryuqq.drover.application.launcher;

import com.ryuqq.drover.application.orchestrator.OrchestratorConfig;

import java.time.Duration;

/**
 * 실행 요청 (경계 입력).
 *
 * @param workers 동시 Worker 수 (1 이상)
 * @param taskTimeout Task 실행 제한 시간 (양수)
 * @param maxRetries Task당 실행 시도 예산 (1 이상)
 * @param taskLimit 처리할 결과 이벤트 상한 (0은 무제한)
 * @param epicFilter 대상 Epic ID (null이면 전체)
 * @param dryRun true면 매니페스트만 조회하고 실행하지 않음
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunRequest(
    int workers,
    Duration taskTimeout,
    int maxRetries,
    int taskLimit,
    String epicFilter,
    boolean dryRun
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunRequest {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive (current: " + workers + ")");
        }
        if (taskTimeout == null || taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("taskTimeout must be positive (current: " + taskTimeout + ")");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
        if (taskLimit < 0) {
            throw new IllegalArgumentException("taskLimit cannot be negative (current: " + taskLimit + ")");
        }
        epicFilter = epicFilter == null || epicFilter.isBlank() ? null : epicFilter.trim();
    }

    /**
     * 설정 기본값을 그대로 사용하는 요청 생성.
     *
     * @param config 기준 설정
     * @return 전체 대상, 실제 실행 요청
     */
    public static RunRequest defaults(OrchestratorConfig config) {
        return new RunRequest(config.maxWorkers(), config.taskTimeout(), config.maxTaskAttempts(),
            config.taskLimit(), null, false);
    }

    public RunRequest withEpicFilter(String epicFilter) {
        return new RunRequest(workers, taskTimeout, maxRetries, taskLimit, epicFilter, dryRun);
    }

    public RunRequest withDryRun(boolean dryRun) {
        return new RunRequest(workers, taskTimeout, maxRetries, taskLimit, epicFilter, dryRun);
    }

    public RunRequest withWorkers(int workers) {
        return new RunRequest(workers, taskTimeout, maxRetries, taskLimit, epicFilter, dryRun);
    }

    public RunRequest withTaskLimit(int taskLimit) {
        return new RunRequest(workers, taskTimeout, maxRetries, taskLimit, epicFilter, dryRun);
    }

    /**
     * Epic 필터 지정 여부.
     *
     * @return epicFilter가 있으면 true
     */
    public boolean hasEpicFilter() {
        return epicFilter != null;
    }

    /**
     * 요청 값을 기준 설정에 덮어쓴 설정 생성.
     *
     * @param base 기준 설정
     * @return 새 설정
     */
    public OrchestratorConfig applyTo(OrchestratorConfig base) {
        return base
            .withMaxWorkers(workers)
            .withTaskTimeout(taskTimeout)
            .withMaxTaskAttempts(maxRetries)
            .withTaskLimit(taskLimit);
    }
}
