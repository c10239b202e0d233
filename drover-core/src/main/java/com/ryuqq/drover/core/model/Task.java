package com.ryuqq.drover.core.model;

import com.ryuqq.drover.core.statemachine.TaskStatus;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 외부에서 실행되는 작업 단위.
 *
 * <p>불변 record이며, 실행 중 상태 변경은 Orchestrator가 {@code withX(...)}로
 * 새 인스턴스를 만들어 canonical task map에 교체하는 방식으로만 이루어집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>attempts는 음수가 될 수 없음</li>
 *   <li>blockedBy는 집합 의미(중복 없음)이며 삽입 순서를 유지</li>
 * </ul>
 *
 * @param id Task ID (실행 내 고유)
 * @param title 제목
 * @param description 설명 (선택, null 가능)
 * @param priority 우선순위 (클수록 긴급)
 * @param status 생명주기 상태
 * @param parentEpic 상위 Epic ID (선택, null 가능)
 * @param blockedBy 차단 요인 Task ID 집합
 * @param labels 라벨 목록
 * @param attempts 실패한 실행 시도 횟수
 * @param lastError 마지막 오류 메시지 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Task(
    TaskId id,
    String title,
    String description,
    int priority,
    TaskStatus status,
    String parentEpic,
    Set<TaskId> blockedBy,
    List<String> labels,
    int attempts,
    String lastError
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 attempts가 음수인 경우
     */
    public Task {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative (current: " + attempts + ")");
        }
        blockedBy = blockedBy == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(blockedBy));
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    /**
     * READY 상태의 최소 Task 생성.
     *
     * @param id Task ID
     * @param title 제목
     * @param priority 우선순위
     * @return READY Task
     */
    public static Task ready(TaskId id, String title, int priority) {
        return new Task(id, title, null, priority, TaskStatus.READY, null, Set.of(), List.of(), 0, null);
    }

    /**
     * status만 변경한 새 인스턴스 생성.
     */
    public Task withStatus(TaskStatus status) {
        return new Task(id, title, description, priority, status, parentEpic, blockedBy, labels, attempts, lastError);
    }

    /**
     * attempts만 변경한 새 인스턴스 생성.
     */
    public Task withAttempts(int attempts) {
        return new Task(id, title, description, priority, status, parentEpic, blockedBy, labels, attempts, lastError);
    }

    /**
     * lastError만 변경한 새 인스턴스 생성.
     */
    public Task withLastError(String lastError) {
        return new Task(id, title, description, priority, status, parentEpic, blockedBy, labels, attempts, lastError);
    }

    /**
     * blockedBy만 변경한 새 인스턴스 생성.
     */
    public Task withBlockedBy(Collection<TaskId> blockedBy) {
        if (blockedBy == null) {
            throw new IllegalArgumentException("blockedBy cannot be null");
        }
        return withOrderedBlockers(blockedBy);
    }

    /**
     * blockedBy에서 특정 ID를 제거한 새 인스턴스 생성.
     *
     * @param blocker 제거할 차단 요인
     * @return 새 인스턴스 (포함되지 않은 경우 this)
     */
    public Task withoutBlocker(TaskId blocker) {
        if (!blockedBy.contains(blocker)) {
            return this;
        }
        Set<TaskId> remaining = new LinkedHashSet<>(blockedBy);
        remaining.remove(blocker);
        return withOrderedBlockers(remaining);
    }

    /**
     * 특정 라벨 보유 여부.
     *
     * @param label 라벨
     * @return 보유 시 true
     */
    public boolean hasLabel(String label) {
        return labels.contains(label);
    }

    private Task withOrderedBlockers(Collection<TaskId> ordered) {
        return new Task(id, title, description, priority, status, parentEpic,
            new LinkedHashSet<>(ordered), labels, attempts, lastError);
    }
}
