package com.ryuqq.drover.application.orchestrator;

import java.time.Duration;

/**
 * Orchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxWorkers: 동시 Worker 수 (기본 4)</li>
 *   <li>maxTaskAttempts: Task당 실행 시도 예산 (기본 3)</li>
 *   <li>taskTimeout: Task 1회 실행 제한 시간 (기본 600초)</li>
 *   <li>stallThreshold: 진행 없음으로 판단하는 임계값 (기본 300초)</li>
 *   <li>stallCheckInterval: Stall 검사 주기 (기본 60초)</li>
 *   <li>pollInterval: 이벤트 대기 후 완료 조건 재검사 주기 (기본 5초)</li>
 *   <li>autoUnblock: 차단 요인별 remediation Task 자동 생성 여부 (기본 true)</li>
 *   <li>taskLimit: 처리할 Task 결과 이벤트 상한, 0이면 무제한 (기본 0)</li>
 *   <li>eventChannelCapacity: 이벤트 채널 용량 (기본 1000)</li>
 *   <li>remediationPriority: remediation Task 우선순위 (기본 100)</li>
 *   <li>remediationLabel: remediation Task 라벨 (기본 drover-auto)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxWorkers 동시 Worker 수 (1 이상)
 * @param maxTaskAttempts 실행 시도 예산 (1 이상)
 * @param taskTimeout Task 실행 제한 시간 (양수)
 * @param stallThreshold Stall 임계값 (양수)
 * @param stallCheckInterval Stall 검사 주기 (양수)
 * @param pollInterval 이벤트 대기 주기 (양수)
 * @param autoUnblock remediation 자동 생성 여부
 * @param taskLimit 결과 이벤트 상한 (0 이상, 0은 무제한)
 * @param eventChannelCapacity 이벤트 채널 용량 (1 이상)
 * @param remediationPriority remediation Task 우선순위
 * @param remediationLabel remediation Task 라벨 (blank 불가)
 */
public record OrchestratorConfig(
    int maxWorkers,
    int maxTaskAttempts,
    Duration taskTimeout,
    Duration stallThreshold,
    Duration stallCheckInterval,
    Duration pollInterval,
    boolean autoUnblock,
    int taskLimit,
    int eventChannelCapacity,
    int remediationPriority,
    String remediationLabel
) {

    /**
     * 기본 설정 생성자.
     */
    public OrchestratorConfig() {
        this(4, 3, Duration.ofSeconds(600), Duration.ofSeconds(300), Duration.ofSeconds(60),
            Duration.ofSeconds(5), true, 0, 1000, 100, "drover-auto");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive (current: " + maxWorkers + ")");
        }
        if (maxTaskAttempts <= 0) {
            throw new IllegalArgumentException("maxTaskAttempts must be positive (current: " + maxTaskAttempts + ")");
        }
        requirePositive("taskTimeout", taskTimeout);
        requirePositive("stallThreshold", stallThreshold);
        requirePositive("stallCheckInterval", stallCheckInterval);
        requirePositive("pollInterval", pollInterval);
        if (taskLimit < 0) {
            throw new IllegalArgumentException("taskLimit cannot be negative (current: " + taskLimit + ")");
        }
        if (eventChannelCapacity <= 0) {
            throw new IllegalArgumentException(
                "eventChannelCapacity must be positive (current: " + eventChannelCapacity + ")");
        }
        if (remediationLabel == null || remediationLabel.isBlank()) {
            throw new IllegalArgumentException("remediationLabel cannot be null or blank");
        }
    }

    /**
     * 결과 이벤트 상한이 설정되었는지 확인.
     *
     * @return taskLimit &gt; 0이면 true
     */
    public boolean hasTaskLimit() {
        return taskLimit > 0;
    }

    public OrchestratorConfig withMaxWorkers(int maxWorkers) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    public OrchestratorConfig withMaxTaskAttempts(int maxTaskAttempts) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    public OrchestratorConfig withTaskTimeout(Duration taskTimeout) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    /**
     * Stall 임계값과 검사 주기를 함께 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withStallDetection(Duration stallThreshold, Duration stallCheckInterval) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    public OrchestratorConfig withPollInterval(Duration pollInterval) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    public OrchestratorConfig withAutoUnblock(boolean autoUnblock) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    public OrchestratorConfig withTaskLimit(int taskLimit) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    public OrchestratorConfig withEventChannelCapacity(int eventChannelCapacity) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    /**
     * remediation Task 우선순위와 라벨을 함께 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withRemediation(int remediationPriority, String remediationLabel) {
        return new OrchestratorConfig(maxWorkers, maxTaskAttempts, taskTimeout, stallThreshold, stallCheckInterval,
            pollInterval, autoUnblock, taskLimit, eventChannelCapacity, remediationPriority, remediationLabel);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
