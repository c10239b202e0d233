package com.ryuqq.drover.testkit.fixture;

import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.spi.TaskExecutionException;
import com.ryuqq.drover.core.spi.TaskRunner;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task별로 실행 결과를 미리 정해 두는 테스트용 {@link TaskRunner}.
 *
 * <p>Task에 지정된 단계는 순서대로 소비되며, 마지막 단계는 이후 호출에서 반복됩니다.
 * 단계가 지정되지 않은 Task는 기본 단계({@link #otherwise(Step)})를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ScriptedTaskRunner runner = ScriptedTaskRunner.alwaysSucceeding()
 *     .script(TaskId.of("t-1"), ScriptedTaskRunner.fail("flaky"), ScriptedTaskRunner.succeed());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedTaskRunner implements TaskRunner {

    /**
     * 실행 1회 동작.
     */
    @FunctionalInterface
    public interface Step {
        Duration run(Task task) throws TaskExecutionException, InterruptedException;
    }

    private final Map<TaskId, Deque<Step>> scripts = new ConcurrentHashMap<>();
    private final List<TaskId> invocations = Collections.synchronizedList(new ArrayList<>());
    private volatile Step fallback;

    private ScriptedTaskRunner(Step fallback) {
        this.fallback = fallback;
    }

    public static ScriptedTaskRunner alwaysSucceeding() {
        return new ScriptedTaskRunner(succeed());
    }

    public static ScriptedTaskRunner alwaysFailing(String message) {
        return new ScriptedTaskRunner(fail(message));
    }

    /**
     * 특정 Task의 실행 단계 지정.
     *
     * @param taskId Task ID
     * @param steps 단계 (1개 이상)
     * @return this
     */
    public ScriptedTaskRunner script(TaskId taskId, Step... steps) {
        if (steps.length == 0) {
            throw new IllegalArgumentException("steps cannot be empty");
        }
        scripts.put(taskId, new ArrayDeque<>(List.of(steps)));
        return this;
    }

    public ScriptedTaskRunner otherwise(Step step) {
        this.fallback = step;
        return this;
    }

    @Override
    public Duration execute(Task task) throws TaskExecutionException, InterruptedException {
        invocations.add(task.id());
        return nextStep(task.id()).run(task);
    }

    /**
     * 호출된 Task ID 목록 (호출 순서).
     *
     * @return 스냅샷
     */
    public List<TaskId> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    public int invocationCount(TaskId taskId) {
        return (int) invocations().stream().filter(taskId::equals).count();
    }

    private Step nextStep(TaskId taskId) {
        Deque<Step> steps = scripts.get(taskId);
        if (steps == null) {
            return fallback;
        }
        synchronized (steps) {
            return steps.size() > 1 ? steps.poll() : steps.peek();
        }
    }

    // ========== 단계 생성 ==========

    public static Step succeed() {
        return task -> Duration.ofMillis(1);
    }

    public static Step fail(String message) {
        return task -> {
            throw new TaskExecutionException(message);
        };
    }

    public static Step failPermanently(String message) {
        return task -> {
            throw TaskExecutionException.permanent(message);
        };
    }

    public static Step blockedBy(String... blockerIds) {
        return fail("Task is blocked by " + String.join(", ", blockerIds));
    }

    /**
     * 인터럽트될 때까지 끝나지 않는 단계.
     */
    public static Step hang() {
        return task -> {
            Thread.sleep(Long.MAX_VALUE);
            return Duration.ZERO;
        };
    }

    public static Step throwing(RuntimeException exception) {
        return task -> {
            throw exception;
        };
    }
}
