package com.ryuqq.drover.adapter.inmemory.source;

import com.ryuqq.drover.core.model.Epic;
import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkItem;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.WorkSourceException;
import com.ryuqq.drover.core.statemachine.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryWorkSource 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryWorkSourceTest {

    private InMemoryWorkSource workSource;

    @BeforeEach
    void setUp() {
        workSource = new InMemoryWorkSource(List.of(
            WorkItem.epic("epic-1", "Checkout"),
            WorkItem.task("t-1", "cart", 2, "open").withParent("epic-1"),
            WorkItem.task("t-2", "payment", 1, "closed").withParent("epic-1"),
            WorkItem.task("t-3", "docs", 0, "open")
        ));
    }

    @Test
    void discoverAll_Epic과_독립_Task로_매니페스트를_조립함() {
        // when
        WorkManifest manifest = workSource.discoverAll();

        // then
        assertThat(manifest.epics()).extracting(Epic::id).containsExactly("epic-1");
        assertThat(manifest.standaloneTasks()).extracting(Task::id).containsExactly(TaskId.of("t-3"));
        assertThat(manifest.totalTasks()).isEqualTo(3);
        assertThat(manifest.completedTasks()).isEqualTo(1);
    }

    @Test
    void discoverEpic_소속_Task를_모두_반환함() {
        // when
        Epic epic = workSource.discoverEpic("epic-1");

        // then
        assertThat(epic.title()).isEqualTo("Checkout");
        assertThat(epic.tasks()).extracting(Task::id).containsExactly(TaskId.of("t-1"), TaskId.of("t-2"));
        assertThat(epic.progress()).isEqualTo(50.0);
    }

    @Test
    void discoverEpic_없는_Epic이면_예외_발생() {
        // when & then
        assertThatThrownBy(() -> workSource.discoverEpic("epic-x"))
            .isInstanceOf(WorkSourceException.class)
            .hasMessageContaining("epic-x");
        assertThatThrownBy(() -> workSource.discoverEpic("t-1"))
            .isInstanceOf(WorkSourceException.class);
    }

    @Test
    void createTask_mem_접두사_ID를_순서대로_발급함() {
        // when
        TaskId first = workSource.createTask("Fix: bd-1");
        TaskId second = workSource.createTask("Fix: bd-2");

        // then
        assertThat(first).isEqualTo(TaskId.of("mem-1"));
        assertThat(second).isEqualTo(TaskId.of("mem-2"));
        assertThat(workSource.createdTasks()).containsExactly(first, second);
        assertThat(workSource.discoverAll().standaloneTasks()).extracting(Task::title).contains("Fix: bd-1");
    }

    @Test
    void closeTask_항목을_closed로_바꾸고_사유를_기록함() {
        // when
        workSource.closeTask(TaskId.of("t-3"), "Completed by Drover");

        // then
        assertThat(workSource.closedTasks()).containsExactly(Map.entry(TaskId.of("t-3"), "Completed by Drover"));
        assertThat(workSource.find("t-3").toTask(null).status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(workSource.discoverAll().standaloneTasks()).isEmpty();
    }

    @Test
    void closeTask_없는_항목이면_예외_발생() {
        // when & then
        assertThatThrownBy(() -> workSource.closeTask(TaskId.of("ghost"), "done"))
            .isInstanceOf(WorkSourceException.class);
    }

    @Test
    void add_중복_ID면_예외_발생() {
        // when & then
        assertThatThrownBy(() -> workSource.add(WorkItem.task("t-1", "again", 0, "open")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createTask_이미_있는_ID는_건너뛰고_기존_항목을_보존함() {
        // given
        WorkItem existing = WorkItem.task("mem-1", "Pre-existing", 3, "open");
        workSource.add(existing);

        // when
        TaskId created = workSource.createTask("Fix: ext-1");

        // then
        assertThat(created).isEqualTo(TaskId.of("mem-2"));
        assertThat(workSource.find("mem-1")).isEqualTo(existing);
        assertThat(workSource.find("mem-2").title()).isEqualTo("Fix: ext-1");
        assertThat(workSource.createdTasks()).containsExactly(TaskId.of("mem-2"));
    }
}
