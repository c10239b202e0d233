package com.ryuqq.drover.core.model;

import com.ryuqq.drover.core.statemachine.TaskStatus;

import java.util.Collection;

/**
 * Task 집합의 상태별 집계.
 *
 * @param total 전체 Task 수
 * @param ready READY 수
 * @param blocked BLOCKED 수
 * @param completed COMPLETED 수
 * @param failed FAILED 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskStats(
    int total,
    int ready,
    int blocked,
    int completed,
    int failed
) {

    /**
     * Task 목록으로부터 집계.
     *
     * @param tasks Task 목록
     * @return 집계 결과
     * @throws IllegalArgumentException tasks가 null인 경우
     */
    public static TaskStats of(Collection<Task> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        int ready = 0;
        int blocked = 0;
        int completed = 0;
        int failed = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case READY -> ready++;
                case BLOCKED -> blocked++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case IN_PROGRESS -> {
                    // 집계 대상 아님
                }
            }
        }
        return new TaskStats(tasks.size(), ready, blocked, completed, failed);
    }

    /**
     * 완료 비율 (퍼센트).
     *
     * @return completed / total * 100, Task가 없으면 100.0
     */
    public double progress() {
        return percentCompleted(completed, total);
    }

    static double percentCompleted(int completed, int total) {
        if (total == 0) {
            return 100.0;
        }
        return (double) completed / total * 100.0;
    }

    static boolean isCompleted(Task task) {
        return task.status() == TaskStatus.COMPLETED;
    }
}
