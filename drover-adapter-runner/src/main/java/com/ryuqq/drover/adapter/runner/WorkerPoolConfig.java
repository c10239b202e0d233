package com.ryuqq.drover.adapter.runner;

import com.ryuqq.drover.application.orchestrator.OrchestratorConfig;

import java.time.Duration;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * ThreadPoolWorkerPool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: Worker 수</li>
 *   <li>taskTimeout: Task 1회 실행 제한 시간</li>
 *   <li>idleBackoff: 선점할 Task가 없을 때 재시도 간격 (기본 5초)</li>
 *   <li>blockerIdPattern: 실패 메시지에서 차단 요인 ID를 찾는 정규식 (기본 {@code bd-[a-z0-9]+})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param workerCount Worker 수 (1 이상)
 * @param taskTimeout 실행 제한 시간 (양수)
 * @param idleBackoff 유휴 재시도 간격 (양수)
 * @param blockerIdPattern 차단 요인 ID 정규식 (유효한 정규식)
 */
public record WorkerPoolConfig(
    int workerCount,
    Duration taskTimeout,
    Duration idleBackoff,
    String blockerIdPattern
) {

    public static final Duration DEFAULT_IDLE_BACKOFF = Duration.ofSeconds(5);
    public static final String DEFAULT_BLOCKER_ID_PATTERN = "bd-[a-z0-9]+";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerCount=4, taskTimeout=600초, idleBackoff=5초, blockerIdPattern=bd-[a-z0-9]+</p>
     */
    public WorkerPoolConfig() {
        this(4, Duration.ofSeconds(600), DEFAULT_IDLE_BACKOFF, DEFAULT_BLOCKER_ID_PATTERN);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerPoolConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive (current: " + workerCount + ")");
        }
        if (taskTimeout == null || taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("taskTimeout must be positive (current: " + taskTimeout + ")");
        }
        if (idleBackoff == null || idleBackoff.isZero() || idleBackoff.isNegative()) {
            throw new IllegalArgumentException("idleBackoff must be positive (current: " + idleBackoff + ")");
        }
        if (blockerIdPattern == null || blockerIdPattern.isBlank()) {
            throw new IllegalArgumentException("blockerIdPattern cannot be null or blank");
        }
        try {
            Pattern.compile(blockerIdPattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("blockerIdPattern is not a valid regex (current: " + blockerIdPattern + ")", e);
        }
    }

    /**
     * Orchestrator 설정에서 Worker 수와 실행 제한 시간을 가져온 설정 생성.
     *
     * @param config Orchestrator 설정
     * @return WorkerPoolConfig (나머지 항목은 기본값)
     */
    public static WorkerPoolConfig from(OrchestratorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new WorkerPoolConfig(config.maxWorkers(), config.taskTimeout(), DEFAULT_IDLE_BACKOFF,
            DEFAULT_BLOCKER_ID_PATTERN);
    }

    public WorkerPoolConfig withWorkerCount(int workerCount) {
        return new WorkerPoolConfig(workerCount, taskTimeout, idleBackoff, blockerIdPattern);
    }

    public WorkerPoolConfig withTaskTimeout(Duration taskTimeout) {
        return new WorkerPoolConfig(workerCount, taskTimeout, idleBackoff, blockerIdPattern);
    }

    public WorkerPoolConfig withIdleBackoff(Duration idleBackoff) {
        return new WorkerPoolConfig(workerCount, taskTimeout, idleBackoff, blockerIdPattern);
    }

    public WorkerPoolConfig withBlockerIdPattern(String blockerIdPattern) {
        return new WorkerPoolConfig(workerCount, taskTimeout, idleBackoff, blockerIdPattern);
    }
}
