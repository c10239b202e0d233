package com.ryuqq.drover.core.model;

/**
 * 프로젝트 진행 현황 요약.
 *
 * @param total 전체 Task 수
 * @param completed 완료 수
 * @param ready 실행 대기 수
 * @param blocked 차단 수
 * @param failed 실패 수
 * @param progress 완료 비율 (퍼센트, Task가 없으면 100.0)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProjectStatus(
    int total,
    int completed,
    int ready,
    int blocked,
    int failed,
    double progress
) {

    /**
     * 매니페스트로부터 현황 계산.
     *
     * @param manifest 매니페스트
     * @return ProjectStatus
     * @throws IllegalArgumentException manifest가 null인 경우
     */
    public static ProjectStatus from(WorkManifest manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        return from(TaskStats.of(manifest.allTasks()));
    }

    /**
     * 집계로부터 현황 계산.
     *
     * @param stats Task 집계
     * @return ProjectStatus
     */
    public static ProjectStatus from(TaskStats stats) {
        return new ProjectStatus(
            stats.total(),
            stats.completed(),
            stats.ready(),
            stats.blocked(),
            stats.failed(),
            stats.progress()
        );
    }
}
