package com.ryuqq.drover.core.model;

import com.ryuqq.drover.core.statemachine.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WorkManifest 조립 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkManifestTest {

    @Test
    void assemble_parent_Epic이_있으면_Epic_소속으로_배치함() {
        // given
        List<WorkItem> items = List.of(
            WorkItem.epic("epic-1", "Checkout"),
            WorkItem.task("t-1", "cart", 2, "open").withParent("epic-1"),
            WorkItem.task("t-2", "payment", 1, "open").withParent("epic-1"),
            WorkItem.task("t-3", "docs", 0, "open")
        );

        // when
        WorkManifest manifest = WorkManifest.assemble(items);

        // then
        assertThat(manifest.epics()).hasSize(1);
        assertThat(manifest.epics().get(0).tasks()).extracting(Task::id)
            .containsExactly(TaskId.of("t-1"), TaskId.of("t-2"));
        assertThat(manifest.standaloneTasks()).extracting(Task::id).containsExactly(TaskId.of("t-3"));
        assertThat(manifest.totalTasks()).isEqualTo(3);
        assertThat(manifest.readyTasks()).isEqualTo(3);
    }

    @Test
    void assemble_없는_Epic을_가리키는_Task는_독립_Task가_됨() {
        // given
        List<WorkItem> items = List.of(WorkItem.task("t-1", "orphan", 1, "open").withParent("epic-x"));

        // when
        WorkManifest manifest = WorkManifest.assemble(items);

        // then
        assertThat(manifest.epics()).isEmpty();
        assertThat(manifest.standaloneTasks()).hasSize(1);
        assertThat(manifest.standaloneTasks().get(0).parentEpic()).isEqualTo("epic-x");
    }

    @Test
    void assemble_완료된_Epic과_완료된_독립_Task는_제외함() {
        // given
        List<WorkItem> items = List.of(
            WorkItem.epic("epic-done", "Done"),
            WorkItem.task("t-1", "finished", 1, "closed").withParent("epic-done"),
            WorkItem.task("t-2", "finished standalone", 1, "closed"),
            WorkItem.task("t-3", "pending", 1, "open")
        );

        // when
        WorkManifest manifest = WorkManifest.assemble(items);

        // then
        assertThat(manifest.epics()).isEmpty();
        assertThat(manifest.allTasks()).extracting(Task::id).containsExactly(TaskId.of("t-3"));
    }

    @Test
    void assemble_Work_Source_상태와_차단_요인을_매핑함() {
        // given
        List<WorkItem> items = List.of(
            WorkItem.task("t-1", "blocked", 1, "blocked").withBlockedBy(List.of("bd-7")),
            WorkItem.task("t-2", "running", 1, "in-progress")
        );

        // when
        WorkManifest manifest = WorkManifest.assemble(items);

        // then
        Task blocked = manifest.standaloneTasks().get(0);
        assertThat(blocked.status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(blocked.blockedBy()).containsExactly(TaskId.of("bd-7"));
        assertThat(manifest.standaloneTasks().get(1).status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(manifest.blockedTasks()).isEqualTo(1);
    }

    @Test
    void targetDescription_대상_구성에_따라_달라짐() {
        // given
        Task task = Task.ready(TaskId.of("t-1"), "task", 1);
        Epic epic = new Epic("epic-1", "Checkout", List.of(task));

        // when & then
        assertThat(WorkManifest.ofEpic(epic).targetDescription()).isEqualTo("Epic: Checkout");
        assertThat(WorkManifest.ofTasks(List.of(task)).targetDescription()).isEqualTo("1 standalone tasks");
        assertThat(WorkManifest.empty().targetDescription()).isEqualTo("0 epics, 0 standalone tasks");
    }

    @Test
    void duplicateTaskIds_Epic과_독립_Task에_걸친_중복을_찾음() {
        // given
        Task task = Task.ready(TaskId.of("t-1"), "task", 1);
        WorkManifest manifest = WorkManifest.of(List.of(new Epic("epic-1", "Epic", List.of(task))), List.of(task));

        // when & then
        assertThat(manifest.duplicateTaskIds()).containsExactly(TaskId.of("t-1"));
    }

    @Test
    void Epic_progress는_완료_비율이고_Task가_없으면_100() {
        // given
        Task done = Task.ready(TaskId.of("t-1"), "done", 1).withStatus(TaskStatus.COMPLETED);
        Task open = Task.ready(TaskId.of("t-2"), "open", 1);

        // when & then
        assertThat(new Epic("e", "E", List.of(done, open)).progress()).isEqualTo(50.0);
        assertThat(new Epic("e", "E", List.of()).progress()).isEqualTo(100.0);
    }
}
