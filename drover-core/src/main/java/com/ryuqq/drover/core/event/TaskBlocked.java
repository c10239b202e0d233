package com.ryuqq.drover.core.event;

import com.ryuqq.drover.core.model.TaskId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Task가 다른 항목에 의해 차단됨.
 *
 * <p>실패가 아닌 스케줄링 상태이며, 재시도 예산을 소비하지 않습니다.</p>
 *
 * @param id 차단된 Task ID
 * @param blockedBy 차단 요인 ID (한 개 이상, 보고 순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskBlocked(
    TaskId id,
    Set<TaskId> blockedBy
) implements WorkerEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 blockedBy가 비어 있는 경우
     */
    public TaskBlocked {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (blockedBy == null || blockedBy.isEmpty()) {
            throw new IllegalArgumentException("blockedBy cannot be null or empty");
        }
        blockedBy = Collections.unmodifiableSet(new LinkedHashSet<>(blockedBy));
    }

    @Override
    public Optional<TaskId> taskId() {
        return Optional.of(id);
    }
}
