package com.ryuqq.drover.testkit.fixture;

import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.statemachine.TaskStatus;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * 테스트용 Task / WorkManifest 생성 도우미.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskFixtures {

    // Utility class - prevent instantiation
    private TaskFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Task ready(String id, int priority) {
        return Task.ready(TaskId.of(id), "Task " + id, priority);
    }

    /**
     * BLOCKED Task 생성.
     *
     * @param id Task ID
     * @param blockers 차단 요인 ID (1개 이상)
     * @return BLOCKED Task
     */
    public static Task blocked(String id, String... blockers) {
        if (blockers.length == 0) {
            throw new IllegalArgumentException("blockers cannot be empty");
        }
        return ready(id, 0)
            .withStatus(TaskStatus.BLOCKED)
            .withBlockedBy(Arrays.stream(blockers).map(TaskId::of).toList());
    }

    public static WorkManifest manifestOf(Task... tasks) {
        return WorkManifest.ofTasks(List.of(tasks));
    }

    /**
     * READY Task n개로 구성된 매니페스트 ({@code t-1} ~ {@code t-n}, priority 0).
     *
     * @param count Task 수
     * @return WorkManifest
     */
    public static WorkManifest readyManifest(int count) {
        return WorkManifest.ofTasks(IntStream.rangeClosed(1, count)
            .mapToObj(i -> ready("t-" + i, 0))
            .toList());
    }
}
