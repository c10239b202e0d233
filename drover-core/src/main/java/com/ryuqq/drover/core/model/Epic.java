package com.ryuqq.drover.core.model;

import java.util.List;

/**
 * 관련 Task의 묶음.
 *
 * <p>순수한 그룹/리포팅 뷰이며, 실행 간에 별도로 저장되지 않습니다.</p>
 *
 * @param id Epic ID
 * @param title 제목
 * @param tasks 소속 Task (순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Epic(
    String id,
    String title,
    List<Task> tasks
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public Epic {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    /**
     * 진행률 (COMPLETED Task 비율, 퍼센트).
     *
     * @return 0.0 ~ 100.0, Task가 없으면 100.0
     */
    public double progress() {
        int completed = (int) tasks.stream().filter(TaskStats::isCompleted).count();
        return TaskStats.percentCompleted(completed, tasks.size());
    }

    /**
     * 모든 Task가 COMPLETED인지 확인.
     *
     * @return 모두 완료 시 true (Task가 없으면 true)
     */
    public boolean isFinished() {
        return tasks.stream().allMatch(TaskStats::isCompleted);
    }
}
