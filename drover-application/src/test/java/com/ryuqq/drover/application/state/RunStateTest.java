package com.ryuqq.drover.application.state;

import com.ryuqq.drover.application.support.MutableClock;
import com.ryuqq.drover.core.model.Epic;
import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.statemachine.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunState 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunStateTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void seed_IN_PROGRESS_Task는_READY로_재구동됨() {
        // given
        Task inProgress = Task.ready(TaskId.of("t-1"), "stale", 1).withStatus(TaskStatus.IN_PROGRESS);
        WorkManifest manifest = WorkManifest.ofTasks(List.of(inProgress));

        // when
        RunState state = RunState.seed(manifest, clock);

        // then
        assertThat(state.find(TaskId.of("t-1"))).map(Task::status).contains(TaskStatus.READY);
    }

    @Test
    void seed_Epic과_독립_Task를_모두_추적함() {
        // given
        Task inEpic = Task.ready(TaskId.of("t-1"), "in epic", 1);
        Task standalone = Task.ready(TaskId.of("t-2"), "standalone", 1);
        WorkManifest manifest = WorkManifest.of(List.of(new Epic("epic-1", "Epic", List.of(inEpic))), List.of(standalone));

        // when
        RunState state = RunState.seed(manifest, clock);

        // then
        assertThat(state.tasks()).extracting(Task::id).containsExactly(TaskId.of("t-1"), TaskId.of("t-2"));
    }

    @Test
    void seed_중복_Task_ID가_있으면_예외_발생() {
        // given
        Task first = Task.ready(TaskId.of("t-1"), "first", 1);
        Task duplicate = Task.ready(TaskId.of("t-1"), "duplicate", 2);
        WorkManifest manifest = WorkManifest.ofTasks(List.of(first, duplicate));

        // when & then
        assertThatThrownBy(() -> RunState.seed(manifest, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("t-1");
    }

    @Test
    void replace_추적하지_않는_Task면_예외_발생() {
        // given
        RunState state = RunState.seed(WorkManifest.empty(), clock);

        // when & then
        assertThatThrownBy(() -> state.replace(Task.ready(TaskId.of("ghost"), "ghost", 1)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recordCompletion_완료_카운트와_마지막_진행_시각을_갱신함() {
        // given
        RunState state = RunState.seed(WorkManifest.empty(), clock);
        Instant started = state.lastProgress();
        clock.advance(Duration.ofSeconds(30));

        // when
        state.recordCompletion();

        // then
        assertThat(state.completedCount()).isEqualTo(1);
        assertThat(state.lastProgress()).isEqualTo(started.plusSeconds(30));
        assertThat(state.elapsed()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void remainingBlockers_BLOCKED_Task의_차단_요인을_중복_없이_모음() {
        // given
        Task a = Task.ready(TaskId.of("t-a"), "a", 1)
            .withStatus(TaskStatus.BLOCKED)
            .withBlockedBy(List.of(TaskId.of("bd-2"), TaskId.of("bd-1")));
        Task b = Task.ready(TaskId.of("t-b"), "b", 1)
            .withStatus(TaskStatus.BLOCKED)
            .withBlockedBy(List.of(TaskId.of("bd-1")));
        RunState state = RunState.seed(WorkManifest.ofTasks(List.of(a, b)), clock);

        // when & then
        assertThat(state.remainingBlockers()).containsExactly(TaskId.of("bd-2"), TaskId.of("bd-1"));
    }

    @Test
    void addRemediation_차단_요인을_처리_완료로_기록하고_대상을_연결함() {
        // given
        RunState state = RunState.seed(WorkManifest.empty(), clock);
        Task remediation = Task.ready(TaskId.of("fix-1"), "Fix: bd-1", 100);

        // when
        state.addRemediation(remediation, TaskId.of("bd-1"));

        // then
        assertThat(state.isRemediated(TaskId.of("bd-1"))).isTrue();
        assertThat(state.remediationTarget(TaskId.of("fix-1"))).contains(TaskId.of("bd-1"));
        assertThat(state.count(TaskStatus.READY)).isEqualTo(1);
    }

    @Test
    void allTerminal_Task가_없으면_true() {
        // given
        RunState state = RunState.seed(WorkManifest.empty(), clock);

        // when & then
        assertThat(state.allTerminal()).isTrue();
    }
}
