package com.ryuqq.drover.core.statemachine;

/**
 * Task 상태 전이 검증 및 실행.
 *
 * <p>Orchestrator가 outcome 이벤트를 반영할 때 허용된 규칙만 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>READY → READY (재시도 재큐잉)</li>
 *   <li>READY → COMPLETED</li>
 *   <li>READY → FAILED</li>
 *   <li>READY → BLOCKED</li>
 *   <li>BLOCKED → READY</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>IN_PROGRESS는 전이 대상이 될 수 없음 (수집 전용)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskTransition {

    // Utility class - prevent instantiation
    private TaskTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TaskStatus from, TaskStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TaskStatus transition(TaskStatus current, TaskStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * 예외 없이 전이 허용 여부만 확인.
     *
     * @param from 현재 상태 (null이면 false)
     * @param to 전이할 상태 (null이면 false)
     * @return 허용된 전이인 경우 true
     */
    public static boolean isAllowed(TaskStatus from, TaskStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case READY -> to == TaskStatus.READY
                || to == TaskStatus.COMPLETED
                || to == TaskStatus.FAILED
                || to == TaskStatus.BLOCKED;
            case BLOCKED -> to == TaskStatus.READY;
            case IN_PROGRESS, COMPLETED, FAILED -> false;
        };
    }
}
