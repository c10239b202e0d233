package com.ryuqq.drover.application.state;

import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.TaskStats;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.statemachine.TaskStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 실행(run) 중 canonical 상태.
 *
 * <p>Task map은 실행 중 유일한 진실 공급원이며, 시작 직후부터 매니페스트와 달라집니다.
 * 실행이 끝날 때까지 어떤 Task도 map에서 제거되지 않습니다.</p>
 *
 * <p><strong>동시성 규칙:</strong></p>
 * <ul>
 *   <li>쓰기: Orchestrator 스레드 하나만 수행 (single writer)</li>
 *   <li>읽기: Claim Registry, Stall Monitor, 리포팅 경로가 동시에 수행</li>
 *   <li>읽기/쓰기 모두 {@link ReentrantReadWriteLock}으로 보호</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunState {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<TaskId, Task> tasks = new LinkedHashMap<>();
    private final Set<TaskId> remediatedBlockers = new HashSet<>();
    private final Map<TaskId, TaskId> remediationTargets = new HashMap<>();
    private final Clock clock;
    private final Instant startedAt;

    private int completedCount;
    private int failedCount;
    private Instant lastProgress;

    private RunState(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.lastProgress = startedAt;
    }

    /**
     * 매니페스트로 실행 상태 초기화.
     *
     * <p>IN_PROGRESS로 수집된 Task는 READY로 재구동됩니다 (이전 실행의 진행 상태는 이어받지 않음).</p>
     *
     * @param manifest 매니페스트
     * @param clock 시계
     * @return 초기화된 RunState
     * @throws IllegalArgumentException manifest/clock이 null이거나 Task ID가 중복된 경우
     */
    public static RunState seed(WorkManifest manifest, Clock clock) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        Set<TaskId> duplicates = manifest.duplicateTaskIds();
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Task ids must be unique within a run (duplicates: " + duplicates + ")");
        }

        RunState state = new RunState(clock);
        for (Task task : manifest.allTasks()) {
            Task seeded = task.status() == TaskStatus.IN_PROGRESS ? task.withStatus(TaskStatus.READY) : task;
            state.tasks.put(seeded.id(), seeded);
        }
        return state;
    }

    // ========== 읽기 (동시 접근 허용) ==========

    public Optional<Task> find(TaskId id) {
        return read(() -> Optional.ofNullable(tasks.get(id)));
    }

    public boolean contains(TaskId id) {
        return read(() -> tasks.containsKey(id));
    }

    /**
     * 전체 Task 스냅샷 (삽입 순서).
     *
     * @return 불변 Task 목록
     */
    public List<Task> tasks() {
        return read(() -> List.copyOf(tasks.values()));
    }

    /**
     * 특정 상태의 Task 스냅샷.
     *
     * @param status 상태
     * @return 불변 Task 목록
     */
    public List<Task> tasksIn(TaskStatus status) {
        return read(() -> tasks.values().stream().filter(task -> task.status() == status).toList());
    }

    public int count(TaskStatus status) {
        return read(() -> (int) tasks.values().stream().filter(task -> task.status() == status).count());
    }

    /**
     * 모든 Task가 종료 상태인지 확인.
     *
     * @return 모두 COMPLETED 또는 FAILED면 true (Task가 없으면 true)
     */
    public boolean allTerminal() {
        return read(() -> tasks.values().stream().allMatch(task -> task.status().isTerminal()));
    }

    public TaskStats stats() {
        return read(() -> TaskStats.of(tasks.values()));
    }

    /**
     * 여전히 BLOCKED인 Task들의 blockedBy 합집합.
     *
     * @return 중복 제거된 차단 요인 (발견 순서)
     */
    public Set<TaskId> remainingBlockers() {
        return read(() -> {
            Set<TaskId> blockers = new LinkedHashSet<>();
            tasks.values().stream()
                .filter(task -> task.status() == TaskStatus.BLOCKED)
                .forEach(task -> blockers.addAll(task.blockedBy()));
            return blockers;
        });
    }

    public int completedCount() {
        return read(() -> completedCount);
    }

    public int failedCount() {
        return read(() -> failedCount);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant lastProgress() {
        return read(() -> lastProgress);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    /**
     * 이번 실행에서 이미 remediation Task를 만든 차단 요인인지 확인.
     *
     * @param blocker 차단 요인 ID
     * @return 이미 처리했으면 true
     */
    public boolean isRemediated(TaskId blocker) {
        return read(() -> remediatedBlockers.contains(blocker));
    }

    /**
     * remediation Task가 해소하려는 차단 요인 조회.
     *
     * @param remediationTask remediation Task ID
     * @return 대상 차단 요인 (remediation Task가 아니면 empty)
     */
    public Optional<TaskId> remediationTarget(TaskId remediationTask) {
        return read(() -> Optional.ofNullable(remediationTargets.get(remediationTask)));
    }

    // ========== 쓰기 (Orchestrator 스레드 전용) ==========

    /**
     * 기존 Task 교체.
     *
     * @param task 새 Task (같은 ID가 이미 있어야 함)
     * @throws IllegalStateException 추적 중이 아닌 Task인 경우
     */
    public void replace(Task task) {
        write(() -> {
            if (!tasks.containsKey(task.id())) {
                throw new IllegalStateException("Task is not tracked in this run: " + task.id());
            }
            tasks.put(task.id(), task);
        });
    }

    /**
     * remediation Task 추가 및 차단 요인을 처리 완료로 기록.
     *
     * @param remediation 새 remediation Task
     * @param blocker 대상 차단 요인
     * @throws IllegalStateException 같은 ID의 Task가 이미 있는 경우
     */
    public void addRemediation(Task remediation, TaskId blocker) {
        write(() -> {
            if (tasks.containsKey(remediation.id())) {
                throw new IllegalStateException("Task is already tracked in this run: " + remediation.id());
            }
            tasks.put(remediation.id(), remediation);
            remediatedBlockers.add(blocker);
            remediationTargets.put(remediation.id(), blocker);
        });
    }

    /**
     * remediation Task 없이 차단 요인을 처리 완료로 기록.
     *
     * @param blocker 차단 요인
     */
    public void markRemediated(TaskId blocker) {
        write(() -> remediatedBlockers.add(blocker));
    }

    /**
     * 완료 카운트 증가 및 마지막 진행 시각 갱신.
     */
    public void recordCompletion() {
        write(() -> {
            completedCount++;
            lastProgress = clock.instant();
        });
    }

    /**
     * 실패 카운트 증가.
     */
    public void recordFailure() {
        write(() -> failedCount++);
    }

    /**
     * 상태를 바꾸는 여러 갱신을 하나의 쓰기 구간에서 수행.
     *
     * @param updates 갱신할 Task 목록
     */
    public void replaceAll(List<Task> updates) {
        write(() -> {
            for (Task task : new ArrayList<>(updates)) {
                if (!tasks.containsKey(task.id())) {
                    throw new IllegalStateException("Task is not tracked in this run: " + task.id());
                }
                tasks.put(task.id(), task);
            }
        });
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable writer) {
        lock.writeLock().lock();
        try {
            writer.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
