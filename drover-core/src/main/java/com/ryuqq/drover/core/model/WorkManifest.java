package com.ryuqq.drover.core.model;

import com.ryuqq.drover.core.statemachine.TaskStatus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 실행 시작 시점에 Work Source로부터 한 번 만들어지는 작업 스냅샷.
 *
 * <p>실행 중 자동 생성되는 remediation Task는 canonical run state에만 추가되며
 * 이 스냅샷에는 소급 반영되지 않습니다.</p>
 *
 * @param epics 진행 중인 Epic 목록
 * @param standaloneTasks Epic에 속하지 않은 Task 목록
 * @param totalTasks 전체 Task 수
 * @param readyTasks READY Task 수
 * @param blockedTasks BLOCKED Task 수
 * @param completedTasks COMPLETED Task 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkManifest(
    List<Epic> epics,
    List<Task> standaloneTasks,
    int totalTasks,
    int readyTasks,
    int blockedTasks,
    int completedTasks
) {

    /**
     * Compact Constructor.
     */
    public WorkManifest {
        epics = epics == null ? List.of() : List.copyOf(epics);
        standaloneTasks = standaloneTasks == null ? List.of() : List.copyOf(standaloneTasks);
    }

    /**
     * Epic과 독립 Task로 매니페스트 생성 (집계 자동 계산).
     *
     * @param epics Epic 목록
     * @param standaloneTasks 독립 Task 목록
     * @return WorkManifest
     */
    public static WorkManifest of(List<Epic> epics, List<Task> standaloneTasks) {
        List<Task> all = new ArrayList<>();
        epics.forEach(epic -> all.addAll(epic.tasks()));
        all.addAll(standaloneTasks);
        TaskStats stats = TaskStats.of(all);
        return new WorkManifest(epics, standaloneTasks, stats.total(), stats.ready(), stats.blocked(), stats.completed());
    }

    /**
     * 단일 Epic 모드 매니페스트 생성.
     *
     * @param epic 대상 Epic
     * @return WorkManifest
     */
    public static WorkManifest ofEpic(Epic epic) {
        if (epic == null) {
            throw new IllegalArgumentException("epic cannot be null");
        }
        return of(List.of(epic), List.of());
    }

    /**
     * 독립 Task만으로 매니페스트 생성.
     *
     * @param tasks Task 목록
     * @return WorkManifest
     */
    public static WorkManifest ofTasks(List<Task> tasks) {
        return of(List.of(), tasks);
    }

    /**
     * 빈 매니페스트.
     *
     * @return Task가 없는 WorkManifest
     */
    public static WorkManifest empty() {
        return of(List.of(), List.of());
    }

    /**
     * Work Source 항목 목록으로부터 매니페스트 조립.
     *
     * <p><strong>조립 규칙:</strong></p>
     * <ol>
     *   <li>Epic 식별 (epic 플래그 또는 {@code epic} 라벨)</li>
     *   <li>나머지 항목은 parent Epic이 있으면 그 Epic으로, 없으면 독립 Task로 배치</li>
     *   <li>모든 Task가 완료된 Epic 제외</li>
     *   <li>완료된 독립 Task 제외</li>
     *   <li>남은 Task 기준으로 집계 계산</li>
     * </ol>
     *
     * @param items Work Source 항목 목록
     * @return WorkManifest
     * @throws IllegalArgumentException items가 null인 경우
     */
    public static WorkManifest assemble(List<WorkItem> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }

        Map<String, WorkItem> epicItems = new LinkedHashMap<>();
        for (WorkItem item : items) {
            if (item.isEpic()) {
                epicItems.put(item.id(), item);
            }
        }

        Map<String, List<Task>> epicTasks = new LinkedHashMap<>();
        epicItems.keySet().forEach(id -> epicTasks.put(id, new ArrayList<>()));
        List<Task> standalone = new ArrayList<>();

        for (WorkItem item : items) {
            if (epicItems.containsKey(item.id())) {
                continue;
            }
            Task task = item.toTask(null);
            List<Task> bucket = task.parentEpic() == null ? null : epicTasks.get(task.parentEpic());
            if (bucket != null) {
                bucket.add(task);
            } else {
                standalone.add(task);
            }
        }

        List<Epic> activeEpics = new ArrayList<>();
        for (WorkItem epicItem : epicItems.values()) {
            Epic epic = new Epic(epicItem.id(), epicItem.title(), epicTasks.get(epicItem.id()));
            if (!epic.isFinished()) {
                activeEpics.add(epic);
            }
        }

        List<Task> activeStandalone = standalone.stream()
            .filter(task -> task.status() != TaskStatus.COMPLETED)
            .toList();

        return of(activeEpics, activeStandalone);
    }

    /**
     * 전체 Task 목록 (Epic 소속 Task 순서대로, 그 다음 독립 Task).
     *
     * @return 불변 Task 목록
     */
    public List<Task> allTasks() {
        List<Task> all = new ArrayList<>();
        epics.forEach(epic -> all.addAll(epic.tasks()));
        all.addAll(standaloneTasks);
        return List.copyOf(all);
    }

    /**
     * 실행 대상 설명.
     *
     * <ul>
     *   <li>Epic 1개, 독립 Task 없음 → {@code Epic: <title>}</li>
     *   <li>Epic 없음, 독립 Task 있음 → {@code <n> standalone tasks}</li>
     *   <li>그 외 → {@code <e> epics, <n> standalone tasks}</li>
     * </ul>
     *
     * @return 설명 문자열
     */
    public String targetDescription() {
        if (epics.size() == 1 && standaloneTasks.isEmpty()) {
            return "Epic: " + epics.get(0).title();
        }
        if (epics.isEmpty() && !standaloneTasks.isEmpty()) {
            return standaloneTasks.size() + " standalone tasks";
        }
        return epics.size() + " epics, " + standaloneTasks.size() + " standalone tasks";
    }

    /**
     * 중복된 Task ID 조회.
     *
     * @return 두 번 이상 등장한 Task ID 집합
     */
    public Set<TaskId> duplicateTaskIds() {
        Set<TaskId> seen = new HashSet<>();
        Set<TaskId> duplicates = new HashSet<>();
        for (Task task : allTasks()) {
            if (!seen.add(task.id())) {
                duplicates.add(task.id());
            }
        }
        return duplicates;
    }
}
