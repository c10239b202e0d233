package com.ryuqq.drover.application.claim;

import com.ryuqq.drover.application.state.RunState;
import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.statemachine.TaskStatus;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Worker들이 READY Task를 원자적으로 선점(claim)하는 레지스트리.
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>하나의 Task는 동시에 최대 한 Worker에게만 할당</li>
 *   <li>선택 기준: 가장 높은 priority, 동률이면 Task ID 오름차순</li>
 *   <li>release된 Task는 Orchestrator가 결과를 반영({@link #settle(TaskId)})하기 전까지 재선점 불가</li>
 * </ul>
 *
 * <p><strong>락 순서:</strong> 레지스트리 락 → RunState 읽기 락.
 * Orchestrator는 RunState 쓰기 락을 쥔 상태로 이 레지스트리를 호출하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ClaimRegistry {

    private static final Comparator<Task> CLAIM_ORDER =
        Comparator.comparingInt(Task::priority).reversed().thenComparing(Task::id);

    private final RunState runState;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TaskId> assignments = new LinkedHashMap<>();
    private final Set<TaskId> awaitingSettlement = new HashSet<>();

    /**
     * Constructor.
     *
     * @param runState canonical 실행 상태
     * @throws IllegalArgumentException runState가 null인 경우
     */
    public ClaimRegistry(RunState runState) {
        if (runState == null) {
            throw new IllegalArgumentException("runState cannot be null");
        }
        this.runState = runState;
    }

    /**
     * 다음 Task 선점.
     *
     * @param workerId Worker ID
     * @return 선점한 Task (가능한 Task가 없으면 empty)
     * @throws IllegalArgumentException workerId가 null이거나 blank인 경우
     * @throws IllegalStateException 이미 선점 중인 Worker인 경우
     */
    public Optional<Task> claim(String workerId) {
        validateWorkerId(workerId);
        lock.lock();
        try {
            if (assignments.containsKey(workerId)) {
                throw new IllegalStateException(
                    "Worker already holds a claim (worker: " + workerId + ", task: " + assignments.get(workerId) + ")");
            }
            Set<TaskId> unavailable = new HashSet<>(assignments.values());
            unavailable.addAll(awaitingSettlement);

            Optional<Task> next = runState.tasksIn(TaskStatus.READY).stream()
                .filter(task -> !unavailable.contains(task.id()))
                .min(CLAIM_ORDER);
            next.ifPresent(task -> assignments.put(workerId, task.id()));
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Worker의 선점 해제 (멱등).
     *
     * <p>해제된 Task는 settlement 대기 상태로 남습니다.</p>
     *
     * @param workerId Worker ID
     */
    public void release(String workerId) {
        validateWorkerId(workerId);
        lock.lock();
        try {
            TaskId released = assignments.remove(workerId);
            if (released != null) {
                awaitingSettlement.add(released);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Orchestrator가 Task 결과를 반영했음을 알림 (멱등).
     *
     * @param taskId Task ID
     */
    public void settle(TaskId taskId) {
        lock.lock();
        try {
            awaitingSettlement.remove(taskId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * canonical READY Task 개수.
     *
     * @return READY 개수 (선점 여부와 무관)
     */
    public int readyCount() {
        return runState.count(TaskStatus.READY);
    }

    /**
     * 아직 진행될 수 있는 작업이 남았는지 확인.
     *
     * @return READY Task, 진행 중인 선점, settlement 대기 중 하나라도 있으면 true
     */
    public boolean hasPendingWork() {
        lock.lock();
        try {
            return !assignments.isEmpty() || !awaitingSettlement.isEmpty() || readyCount() > 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 할당 스냅샷 (리포팅용).
     *
     * @return workerId → taskId 불변 Map
     */
    public Map<String, TaskId> assignments() {
        lock.lock();
        try {
            return Map.copyOf(assignments);
        } finally {
            lock.unlock();
        }
    }

    private static void validateWorkerId(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId cannot be null or blank");
        }
    }
}
