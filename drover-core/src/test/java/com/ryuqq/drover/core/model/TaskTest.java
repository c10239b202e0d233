package com.ryuqq.drover.core.model;

import com.ryuqq.drover.core.statemachine.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    @Test
    void withBlockedBy_중복을_제거하고_순서를_유지함() {
        // given
        Task task = Task.ready(TaskId.of("t-1"), "task", 1);

        // when
        Task blocked = task.withBlockedBy(List.of(TaskId.of("bd-2"), TaskId.of("bd-1"), TaskId.of("bd-2")));

        // then
        assertThat(blocked.blockedBy()).containsExactly(TaskId.of("bd-2"), TaskId.of("bd-1"));
    }

    @Test
    void withoutBlocker_해당_ID만_제거함() {
        // given
        Task blocked = Task.ready(TaskId.of("t-1"), "task", 1)
            .withStatus(TaskStatus.BLOCKED)
            .withBlockedBy(List.of(TaskId.of("bd-1"), TaskId.of("bd-2")));

        // when
        Task shrunk = blocked.withoutBlocker(TaskId.of("bd-1"));

        // then
        assertThat(shrunk.blockedBy()).containsExactly(TaskId.of("bd-2"));
        assertThat(shrunk.status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(blocked.withoutBlocker(TaskId.of("bd-9"))).isSameAs(blocked);
    }

    @Test
    void blockedBy는_외부에서_수정할_수_없음() {
        // given
        Task blocked = Task.ready(TaskId.of("t-1"), "task", 1).withBlockedBy(List.of(TaskId.of("bd-1")));

        // when & then
        assertThatThrownBy(() -> blocked.blockedBy().add(TaskId.of("bd-2")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void attempts가_음수면_예외_발생() {
        // given
        Task task = Task.ready(TaskId.of("t-1"), "task", 1);

        // when & then
        assertThatThrownBy(() -> task.withAttempts(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempts cannot be negative (current: -1)");
    }

    @Test
    void withX는_다른_필드를_보존함() {
        // given
        Task task = new Task(TaskId.of("t-1"), "task", "desc", 7, TaskStatus.READY, "epic-1",
            null, List.of("backend"), 1, null);

        // when
        Task updated = task.withAttempts(2).withLastError("boom");

        // then
        assertThat(updated.priority()).isEqualTo(7);
        assertThat(updated.parentEpic()).isEqualTo("epic-1");
        assertThat(updated.hasLabel("backend")).isTrue();
        assertThat(updated.attempts()).isEqualTo(2);
        assertThat(updated.lastError()).isEqualTo("boom");
        assertThat(updated.blockedBy()).isEmpty();
    }
}
