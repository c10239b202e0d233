package com.ryuqq.drover.core.event;

import com.ryuqq.drover.core.model.TaskId;

import java.util.Optional;

/**
 * Worker와 Stall Monitor가 Orchestrator에게 보내는 이벤트.
 *
 * <p>WorkerEvent는 네 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link TaskCompleted}: Task Runner 성공</li>
 *   <li>{@link TaskFailed}: 실패 (재시도 가능 여부 포함)</li>
 *   <li>{@link TaskBlocked}: 차단 요인 보고</li>
 *   <li>{@link Stalled}: 진행 정체 감지 (관측용)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.
 * Worker는 claim 한 번당 정확히 하나의 Task outcome 이벤트를 보냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface WorkerEvent permits TaskCompleted, TaskFailed, TaskBlocked, Stalled {

    /**
     * 이벤트 대상 Task ID.
     *
     * @return Task outcome 이벤트면 Task ID, {@link Stalled}면 empty
     */
    Optional<TaskId> taskId();

    /**
     * Task outcome 이벤트인지 확인.
     *
     * <p>처리 상한(task limit) 계산과 claim settle 대상은 outcome 이벤트뿐입니다.</p>
     *
     * @return {@link Stalled}가 아니면 true
     */
    default boolean isTaskOutcome() {
        return taskId().isPresent();
    }
}
