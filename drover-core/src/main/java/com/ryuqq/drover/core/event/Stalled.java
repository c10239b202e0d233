package com.ryuqq.drover.core.event;

import com.ryuqq.drover.core.model.TaskId;

import java.time.Duration;
import java.util.Optional;

/**
 * 진행 정체 감지.
 *
 * <p>Stall Monitor가 정체 구간마다 최대 한 번 보냅니다.
 * Orchestrator는 진단 로그만 남기고 Task 상태는 바꾸지 않습니다.</p>
 *
 * @param idleFor 마지막 진행 이후 경과 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Stalled(Duration idleFor) implements WorkerEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException idleFor가 null인 경우
     */
    public Stalled {
        if (idleFor == null) {
            throw new IllegalArgumentException("idleFor cannot be null");
        }
    }

    @Override
    public Optional<TaskId> taskId() {
        return Optional.empty();
    }
}
