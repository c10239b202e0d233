package com.ryuqq.drover.core.event;

import com.ryuqq.drover.core.model.TaskId;

import java.util.Optional;

/**
 * Task Runner 실패.
 *
 * <p>retriable이 true이면 재시도 예산 한 번을 소비하고 READY로 돌아가며,
 * false이거나 예산이 소진되면 FAILED로 종료됩니다.</p>
 *
 * @param id 실패한 Task ID
 * @param error 오류 메시지
 * @param retriable 재시도 가능 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskFailed(
    TaskId id,
    String error,
    boolean retriable
) implements WorkerEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null인 경우
     */
    public TaskFailed {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        error = error == null || error.isBlank() ? "unknown error" : error;
    }

    @Override
    public Optional<TaskId> taskId() {
        return Optional.of(id);
    }
}
