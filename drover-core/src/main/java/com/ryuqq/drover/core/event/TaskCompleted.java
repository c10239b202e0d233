package com.ryuqq.drover.core.event;

import com.ryuqq.drover.core.model.TaskId;

import java.time.Duration;
import java.util.Optional;

/**
 * Task Runner 성공.
 *
 * @param id 완료된 Task ID
 * @param elapsed 실행 소요 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskCompleted(
    TaskId id,
    Duration elapsed
) implements WorkerEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 elapsed가 null인 경우
     */
    public TaskCompleted {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }
    }

    @Override
    public Optional<TaskId> taskId() {
        return Optional.of(id);
    }
}
