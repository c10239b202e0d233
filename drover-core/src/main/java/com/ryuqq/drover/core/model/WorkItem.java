package com.ryuqq.drover.core.model;

import com.ryuqq.drover.core.statemachine.TaskStatus;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Work Source가 보고한 원시 항목 (Task 또는 Epic).
 *
 * <p>상태는 Work Source의 어휘({@code open}, {@code in-progress}, {@code blocked},
 * {@code closed})를 그대로 담으며, {@link #toTask(String)}에서 내부 상태로 매핑됩니다.</p>
 *
 * @param id 항목 ID
 * @param title 제목
 * @param description 설명 (선택, null 가능)
 * @param priority 우선순위
 * @param status Work Source 상태 문자열 (null 가능)
 * @param parent 상위 항목 ID (선택, null 가능)
 * @param blockedBy 차단 요인 ID 목록
 * @param labels 라벨 목록
 * @param epic Epic 여부 플래그
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkItem(
    String id,
    String title,
    String description,
    int priority,
    String status,
    String parent,
    List<String> blockedBy,
    List<String> labels,
    boolean epic
) {

    private static final String EPIC_LABEL = "epic";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public WorkItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        title = title == null ? "" : title;
        blockedBy = blockedBy == null ? List.of() : List.copyOf(blockedBy);
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    /**
     * 단순 Task 항목 생성.
     *
     * @param id 항목 ID
     * @param title 제목
     * @param priority 우선순위
     * @param status Work Source 상태 문자열
     * @return WorkItem
     */
    public static WorkItem task(String id, String title, int priority, String status) {
        return new WorkItem(id, title, null, priority, status, null, List.of(), List.of(), false);
    }

    /**
     * Epic 항목 생성.
     *
     * @param id Epic ID
     * @param title 제목
     * @return WorkItem
     */
    public static WorkItem epic(String id, String title) {
        return new WorkItem(id, title, null, 0, "open", null, List.of(), List.of(), true);
    }

    /**
     * parent만 변경한 새 인스턴스 생성.
     */
    public WorkItem withParent(String parent) {
        return new WorkItem(id, title, description, priority, status, parent, blockedBy, labels, epic);
    }

    /**
     * blockedBy만 변경한 새 인스턴스 생성.
     */
    public WorkItem withBlockedBy(List<String> blockedBy) {
        return new WorkItem(id, title, description, priority, status, parent, blockedBy, labels, epic);
    }

    /**
     * Epic 여부 (플래그 또는 {@code epic} 라벨).
     *
     * @return Epic인 경우 true
     */
    public boolean isEpic() {
        return epic || labels.contains(EPIC_LABEL);
    }

    /**
     * 내부 Task로 변환.
     *
     * @param parentOverride 상위 Epic ID 강제 지정 (null이면 항목의 parent 사용)
     * @return Task (attempts=0, lastError=null)
     */
    public Task toTask(String parentOverride) {
        return new Task(
            TaskId.of(id),
            title,
            description,
            priority,
            TaskStatus.fromWorkSource(status),
            parentOverride != null ? parentOverride : parent,
            new LinkedHashSet<>(blockedBy.stream().map(TaskId::of).toList()),
            labels,
            0,
            null
        );
    }
}
