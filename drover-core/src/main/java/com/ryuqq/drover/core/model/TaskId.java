package com.ryuqq.drover.core.model;

/**
 * Task의 실행(run) 내 고유 식별자.
 *
 * <p>Work Source가 부여한 항목 ID(예: {@code bd-a1b2c3})를 그대로 감싸며,
 * 차단 요인(blocker) ID 역시 같은 타입으로 표현합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskId implements Comparable<TaskId> {

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TaskId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException(
                "TaskId contains invalid characters: '" + value + "'. Only alphanumeric, hyphen, underscore, dot and colon are allowed"
            );
        }
        this.value = value;
    }

    /**
     * TaskId 생성.
     *
     * @param value TaskId 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /**
     * TaskId 값 조회.
     *
     * @return TaskId 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 문자열 사전순 비교.
     *
     * <p>동일 우선순위 Task 간 claim 순서를 결정하는 tie-break 기준입니다.</p>
     */
    @Override
    public int compareTo(TaskId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value.equals(taskId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
