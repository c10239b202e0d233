package com.ryuqq.drover.core.spi;

import com.ryuqq.drover.core.model.RunId;

import java.time.Instant;

/**
 * Checkpoint Store에 저장된 실행 기록.
 *
 * @param id 실행 ID
 * @param startedAt 시작 시각
 * @param completedAt 완료 시각 (진행 중이면 null)
 * @param success 성공 여부 (진행 중이면 null)
 * @param tasksTotal 시작 시점 전체 Task 수
 * @param tasksCompleted 완료 Task 수
 * @param tasksFailed 실패 Task 수
 * @param manifest 매니페스트 직렬화 결과 (불투명 문자열, JDBC 백엔드는 JSON)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunRecord(
    RunId id,
    Instant startedAt,
    Instant completedAt,
    Boolean success,
    int tasksTotal,
    int tasksCompleted,
    int tasksFailed,
    String manifest
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 startedAt이 null인 경우
     */
    public RunRecord {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
    }

    /**
     * 완료 기록인지 확인.
     *
     * @return completedAt이 있으면 true
     */
    public boolean isCompleted() {
        return completedAt != null;
    }
}
