package com.ryuqq.drover.application.orchestrator;

import com.ryuqq.drover.application.claim.ClaimRegistry;
import com.ryuqq.drover.application.monitor.StallMonitor;
import com.ryuqq.drover.application.runtime.EventChannel;
import com.ryuqq.drover.application.runtime.WorkerPool;
import com.ryuqq.drover.application.state.RunState;
import com.ryuqq.drover.core.event.Stalled;
import com.ryuqq.drover.core.event.TaskBlocked;
import com.ryuqq.drover.core.event.TaskCompleted;
import com.ryuqq.drover.core.event.TaskFailed;
import com.ryuqq.drover.core.event.WorkerEvent;
import com.ryuqq.drover.core.model.ProjectStatus;
import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.CheckpointStore;
import com.ryuqq.drover.core.spi.WorkSource;
import com.ryuqq.drover.core.statemachine.TaskStatus;
import com.ryuqq.drover.core.statemachine.TaskTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 실행(run) 하나를 처음부터 끝까지 조율하는 Orchestrator.
 *
 * <p>canonical 실행 상태의 유일한 writer이며, Worker가 보낸 이벤트를 하나씩 받아
 * 상태 전이 규칙에 따라 반영합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. checkpointStore.startRun()        (실패 시 즉시 전파, Worker 미기동)
 * 2. RunState / ClaimRegistry 초기화, StallMonitor / WorkerPool 시작
 * 3. 이벤트 루프
 *    - poll(pollInterval) → 이벤트 반영 → settle(taskId)
 *    - taskLimit 도달 시 조기 종료
 *    - 매 반복마다 완료 조건 확인
 * 4. StallMonitor / WorkerPool 즉시 종료 (finally)
 * 5. RunResult 계산 → checkpointStore.completeRun()
 * </pre>
 *
 * <p><strong>완료 조건:</strong> 모든 Task가 종료 상태이거나, 더 이상 진행될 수 있는 작업이
 * 없음 (READY / 선점 / settlement 대기 모두 없음).</p>
 *
 * <p>한 인스턴스는 한 번만 실행할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String CLOSE_REASON = "Completed by Drover";
    static final String REMEDIATION_TITLE_PREFIX = "Fix: ";
    static final String FALLBACK_ID_PREFIX = "drover-fix-";
    private static final int STALL_DIAGNOSTIC_LIMIT = 3;

    private final RunId runId = RunId.generate();
    private final WorkManifest manifest;
    private final OrchestratorConfig config;
    private final WorkSource workSource;
    private final CheckpointStore checkpointStore;
    private final WorkerPool workerPool;
    private final Clock clock;

    private volatile boolean stopRequested;
    private volatile RunState runState;
    private ClaimRegistry claimRegistry;
    private boolean started;
    private int processed;

    /**
     * 생성자.
     *
     * @param manifest 실행 대상 매니페스트
     * @param config 설정
     * @param workSource 작업 출처 (Task 종료, remediation Task 생성)
     * @param checkpointStore 실행 기록 저장소
     * @param workerPool Worker 풀
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Orchestrator(WorkManifest manifest, OrchestratorConfig config, WorkSource workSource,
                        CheckpointStore checkpointStore, WorkerPool workerPool) {
        this(manifest, config, workSource, checkpointStore, workerPool, Clock.systemUTC());
    }

    Orchestrator(WorkManifest manifest, OrchestratorConfig config, WorkSource workSource,
                 CheckpointStore checkpointStore, WorkerPool workerPool, Clock clock) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (workSource == null) {
            throw new IllegalArgumentException("workSource cannot be null");
        }
        if (checkpointStore == null) {
            throw new IllegalArgumentException("checkpointStore cannot be null");
        }
        if (workerPool == null) {
            throw new IllegalArgumentException("workerPool cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.manifest = manifest;
        this.config = config;
        this.workSource = workSource;
        this.checkpointStore = checkpointStore;
        this.workerPool = workerPool;
        this.clock = clock;
    }

    public RunId runId() {
        return runId;
    }

    /**
     * 실행.
     *
     * @return 실행 결과
     * @throws IllegalStateException 이미 실행된 인스턴스인 경우
     * @throws IllegalArgumentException 매니페스트에 중복 Task ID가 있는 경우
     * @throws com.ryuqq.drover.core.spi.CheckpointException 실행 기록 저장 실패 시
     */
    public RunResult run() {
        synchronized (this) {
            if (started) {
                throw new IllegalStateException("Orchestrator can only run once (runId: " + runId + ")");
            }
            started = true;
        }

        RunState state = RunState.seed(manifest, clock);
        checkpointStore.startRun(runId, manifest);
        log.info("Run {} started: {} ({} tasks, {} ready, {} blocked)", runId, manifest.targetDescription(),
            manifest.totalTasks(), manifest.readyTasks(), manifest.blockedTasks());

        runState = state;
        claimRegistry = new ClaimRegistry(state);
        EventChannel eventChannel = new EventChannel(config.eventChannelCapacity());
        StallMonitor stallMonitor = new StallMonitor(state, eventChannel,
            config.stallThreshold(), config.stallCheckInterval(), clock);

        try {
            stallMonitor.start();
            workerPool.start(claimRegistry, eventChannel);
            eventLoop(eventChannel);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run {} interrupted, shutting down", runId);
        } finally {
            stallMonitor.stop();
            workerPool.shutdownNow();
        }

        RunResult result = RunResult.of(state.completedCount(), state.failedCount(),
            state.remainingBlockers(), state.elapsed());
        checkpointStore.completeRun(runId, result);
        log.info("Run {} finished: success={}, completed={}, failed={}, blockers={}, duration={}s",
            runId, result.success(), result.tasksCompleted(), result.tasksFailed(), result.blockers(),
            result.duration().toSeconds());
        return result;
    }

    /**
     * 실행 중단 요청.
     *
     * <p>이벤트 루프는 현재 반복을 마친 뒤 종료 절차로 넘어갑니다.</p>
     */
    public void stop() {
        stopRequested = true;
    }

    /**
     * 현재 진행 현황.
     *
     * <p>실행 전에는 매니페스트 기준, 실행 중/후에는 canonical 상태 기준입니다.</p>
     *
     * @return 진행 현황
     */
    public ProjectStatus snapshot() {
        RunState state = runState;
        return state == null ? ProjectStatus.from(manifest) : ProjectStatus.from(state.stats());
    }

    private void eventLoop(EventChannel eventChannel) throws InterruptedException {
        while (!stopRequested) {
            Optional<WorkerEvent> next = eventChannel.poll(config.pollInterval());
            if (next.isPresent()) {
                WorkerEvent event = next.get();
                apply(event);
                if (event.isTaskOutcome()) {
                    processed++;
                    if (config.hasTaskLimit() && processed >= config.taskLimit()) {
                        log.info("Task limit reached ({} outcomes processed), ending run", processed);
                        return;
                    }
                }
            }
            if (isComplete()) {
                return;
            }
        }
        log.info("Run {} stop requested", runId);
    }

    /**
     * 이벤트 1건 반영 후 해당 Task의 settlement 처리.
     *
     * @param event Worker 이벤트
     */
    void apply(WorkerEvent event) {
        if (event instanceof TaskCompleted completed) {
            onCompleted(completed);
        } else if (event instanceof TaskFailed failed) {
            onFailed(failed);
        } else if (event instanceof TaskBlocked blocked) {
            onBlocked(blocked);
        } else if (event instanceof Stalled stalled) {
            onStalled(stalled);
        }
        event.taskId().ifPresent(claimRegistry::settle);
    }

    Optional<Task> findTask(TaskId id) {
        RunState state = runState;
        return state == null ? Optional.empty() : state.find(id);
    }

    boolean isComplete() {
        return runState.allTerminal() || !claimRegistry.hasPendingWork();
    }

    // ========== 이벤트별 전이 ==========

    private void onCompleted(TaskCompleted event) {
        Optional<Task> target = applicableTask(event.id(), TaskStatus.COMPLETED);
        if (target.isEmpty()) {
            return;
        }
        Task task = target.get();
        runState.replace(task.withStatus(TaskTransition.transition(task.status(), TaskStatus.COMPLETED)));
        runState.recordCompletion();
        log.info("Task {} completed in {}s", task.id(), event.elapsed().toSeconds());

        closeQuietly(task.id());
        releaseDependents(task.id());
        // 추적 중인 Task가 차단 요인이면 그 Task의 완료로만 해제됨
        runState.remediationTarget(task.id())
            .filter(blocker -> !runState.contains(blocker))
            .ifPresent(this::releaseDependents);
    }

    private void onFailed(TaskFailed event) {
        Optional<Task> target = applicableTask(event.id(), TaskStatus.FAILED);
        if (target.isEmpty()) {
            return;
        }
        Task task = target.get();
        int maxAttempts = config.maxTaskAttempts();
        int attempts = Math.min(task.attempts() + 1, maxAttempts);
        Task failed = task.withAttempts(attempts).withLastError(event.error());

        if (event.retriable() && task.attempts() < maxAttempts) {
            runState.replace(failed.withStatus(TaskTransition.transition(task.status(), TaskStatus.READY)));
            log.warn("Task {} failed (attempt {}/{}), requeued: {}", task.id(), attempts, maxAttempts, event.error());
            return;
        }
        runState.replace(failed.withStatus(TaskTransition.transition(task.status(), TaskStatus.FAILED)));
        runState.recordFailure();
        log.error("Task {} failed permanently after {} attempt(s): {}", task.id(), attempts, event.error());
    }

    private void onBlocked(TaskBlocked event) {
        Optional<Task> target = applicableTask(event.id(), TaskStatus.BLOCKED);
        if (target.isEmpty()) {
            return;
        }
        Task task = target.get();
        runState.replace(task
            .withStatus(TaskTransition.transition(task.status(), TaskStatus.BLOCKED))
            .withBlockedBy(event.blockedBy()));
        log.warn("Task {} blocked by {}", task.id(), event.blockedBy());

        if (config.autoUnblock()) {
            event.blockedBy().forEach(this::remediate);
        }
    }

    private void onStalled(Stalled event) {
        log.warn("No progress for {}s", event.idleFor().toSeconds());
        if (runState.count(TaskStatus.READY) > 0) {
            return;
        }
        List<Task> blocked = runState.tasksIn(TaskStatus.BLOCKED);
        if (blocked.isEmpty()) {
            return;
        }
        log.warn("No ready tasks, {} blocked", blocked.size());
        blocked.stream()
            .limit(STALL_DIAGNOSTIC_LIMIT)
            .forEach(task -> log.warn("  {} blocked by {}", task.id(), task.blockedBy()));
    }

    // ========== 보조 처리 ==========

    /**
     * 이벤트를 반영할 수 있는 Task 조회.
     *
     * <p>알 수 없는 Task이거나 이미 종료된 Task에 대한 이벤트는 무시합니다.</p>
     */
    private Optional<Task> applicableTask(TaskId id, TaskStatus next) {
        Optional<Task> task = runState.find(id);
        if (task.isEmpty()) {
            log.warn("Ignoring {} event for unknown task {}", next, id);
            return Optional.empty();
        }
        TaskStatus current = task.get().status();
        if (!TaskTransition.isAllowed(current, next)) {
            log.warn("Ignoring {} event for task {} in status {}", next, id, current);
            return Optional.empty();
        }
        return task;
    }

    /**
     * 해소된 ID를 모든 BLOCKED Task의 blockedBy에서 제거하고, 비게 된 Task를 READY로 전환.
     */
    private void releaseDependents(TaskId resolved) {
        List<Task> updates = new ArrayList<>();
        for (Task task : runState.tasksIn(TaskStatus.BLOCKED)) {
            if (!task.blockedBy().contains(resolved)) {
                continue;
            }
            Task updated = task.withoutBlocker(resolved);
            if (updated.blockedBy().isEmpty()) {
                updated = updated.withStatus(TaskTransition.transition(TaskStatus.BLOCKED, TaskStatus.READY));
                log.info("Task {} unblocked", task.id());
            }
            updates.add(updated);
        }
        if (!updates.isEmpty()) {
            runState.replaceAll(updates);
        }
    }

    /**
     * 차단 요인 1개에 대한 remediation Task 주입 (실행당 차단 요인별 최대 1회).
     */
    private void remediate(TaskId blocker) {
        if (runState.isRemediated(blocker)) {
            return;
        }
        String title = REMEDIATION_TITLE_PREFIX + blocker;
        TaskId remediationId;
        try {
            remediationId = workSource.createTask(title);
        } catch (RuntimeException e) {
            remediationId = fallbackRemediationId(blocker);
            log.warn("Failed to create remediation task for {} in work source, tracking it locally as {}",
                blocker, remediationId, e);
        }

        if (runState.contains(remediationId)) {
            log.warn("Remediation task {} for {} is already tracked, not injecting it again", remediationId, blocker);
            runState.markRemediated(blocker);
            return;
        }
        Task remediation = new Task(
            remediationId,
            title,
            "Auto-created by Drover to unblock dependent tasks.\n\nBlocker: " + blocker,
            config.remediationPriority(),
            TaskStatus.READY,
            null,
            Set.of(),
            List.of(config.remediationLabel()),
            0,
            null
        );
        runState.addRemediation(remediation, blocker);
        log.info("Created remediation task {} for blocker {}", remediationId, blocker);
    }

    static TaskId fallbackRemediationId(TaskId blocker) {
        String value = blocker.getValue();
        return TaskId.of(FALLBACK_ID_PREFIX + value.substring(0, Math.min(8, value.length())));
    }

    private void closeQuietly(TaskId id) {
        try {
            workSource.closeTask(id, CLOSE_REASON);
        } catch (RuntimeException e) {
            log.warn("Failed to close task {} in work source", id, e);
        }
    }
}
