package com.ryuqq.drover.core.model;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * 실행(run) 최종 결과.
 *
 * <p><strong>계산 규칙:</strong></p>
 * <ul>
 *   <li>success: 실패 0건 그리고 남은 차단 요인 없음</li>
 *   <li>successRate: completed / (completed + failed), 시도가 없으면 1.0</li>
 *   <li>blockers: 여전히 BLOCKED인 Task들의 blockedBy 합집합 (중복 제거, 정렬)</li>
 * </ul>
 *
 * @param success 성공 여부
 * @param duration 실행 소요 시간
 * @param tasksCompleted 이번 실행에서 완료된 Task 수
 * @param tasksFailed 이번 실행에서 영구 실패한 Task 수
 * @param successRate 성공률 (0.0 ~ 1.0)
 * @param blockers 해소되지 않은 차단 요인 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunResult(
    boolean success,
    Duration duration,
    int tasksCompleted,
    int tasksFailed,
    double successRate,
    List<TaskId> blockers
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException duration이 null이거나 카운트가 음수인 경우
     */
    public RunResult {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        if (tasksCompleted < 0 || tasksFailed < 0) {
            throw new IllegalArgumentException(
                "task counts cannot be negative (completed: " + tasksCompleted + ", failed: " + tasksFailed + ")"
            );
        }
        blockers = blockers == null ? List.of() : List.copyOf(blockers);
    }

    /**
     * 카운트와 차단 요인으로부터 결과 계산.
     *
     * @param completed 완료 수
     * @param failed 실패 수
     * @param blockers 남은 차단 요인 (중복 허용, 결과에서는 제거됨)
     * @param duration 소요 시간
     * @return RunResult
     */
    public static RunResult of(int completed, int failed, Collection<TaskId> blockers, Duration duration) {
        List<TaskId> distinct = List.copyOf(new TreeSet<>(blockers));
        return new RunResult(
            failed == 0 && distinct.isEmpty(),
            duration,
            completed,
            failed,
            successRate(completed, failed),
            distinct
        );
    }

    /**
     * 성공률 계산.
     *
     * @param completed 완료 수
     * @param failed 실패 수
     * @return completed / (completed + failed), 둘 다 0이면 1.0
     */
    public static double successRate(int completed, int failed) {
        int total = completed + failed;
        if (total == 0) {
            return 1.0;
        }
        return (double) completed / total;
    }
}
