package com.ryuqq.drover.application.launcher;

import com.ryuqq.drover.application.orchestrator.OrchestratorConfig;
import com.ryuqq.drover.application.runtime.WorkerPoolFactory;
import com.ryuqq.drover.application.support.SingleThreadWorkerPool;
import com.ryuqq.drover.core.event.TaskCompleted;
import com.ryuqq.drover.core.event.TaskFailed;
import com.ryuqq.drover.core.model.Epic;
import com.ryuqq.drover.core.model.ProjectStatus;
import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.CheckpointStore;
import com.ryuqq.drover.core.spi.WorkSource;
import com.ryuqq.drover.core.spi.WorkSourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * RunLauncher 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@Timeout(10)
class RunLauncherTest {

    private static final OrchestratorConfig BASE_CONFIG = new OrchestratorConfig()
        .withPollInterval(Duration.ofMillis(20));

    @Mock
    private WorkSource workSource;

    @Mock
    private CheckpointStore checkpointStore;

    @Mock
    private WorkerPoolFactory workerPoolFactory;

    private RunLauncher launcher() {
        return new RunLauncher(workSource, checkpointStore, workerPoolFactory, BASE_CONFIG);
    }

    private static WorkManifest twoTasks() {
        return WorkManifest.ofTasks(List.of(
            Task.ready(TaskId.of("t-1"), "first", 1),
            Task.ready(TaskId.of("t-2"), "second", 1)
        ));
    }

    @Test
    void launch_dry_run은_실행하지_않고_매니페스트만_반환함() {
        // given
        WorkManifest manifest = twoTasks();
        when(workSource.discoverAll()).thenReturn(manifest);

        // when
        LaunchReport report = launcher().launch(RunRequest.defaults(BASE_CONFIG).withDryRun(true));

        // then
        assertThat(report.isDryRun()).isTrue();
        assertThat(report.manifest()).isEqualTo(manifest);
        assertThat(report.exitCode()).isZero();
        verify(checkpointStore).init();
        verify(checkpointStore, never()).startRun(any(), any());
        verifyNoInteractions(workerPoolFactory);
    }

    @Test
    void launch_요청_값을_설정에_반영해_실행함() {
        // given
        when(workSource.discoverAll()).thenReturn(twoTasks());
        when(workerPoolFactory.create(any())).thenReturn(
            new SingleThreadWorkerPool(task -> new TaskCompleted(task.id(), Duration.ZERO)));
        RunRequest request = RunRequest.defaults(BASE_CONFIG).withWorkers(2).withTaskLimit(7);

        // when
        LaunchReport report = launcher().launch(request);

        // then
        ArgumentCaptor<OrchestratorConfig> captor = ArgumentCaptor.forClass(OrchestratorConfig.class);
        verify(workerPoolFactory).create(captor.capture());
        assertThat(captor.getValue().maxWorkers()).isEqualTo(2);
        assertThat(captor.getValue().taskLimit()).isEqualTo(7);

        assertThat(report.isDryRun()).isFalse();
        assertThat(report.result().tasksCompleted()).isEqualTo(2);
        assertThat(report.exitCode()).isZero();
        verify(checkpointStore).startRun(report.runId(), report.manifest());
    }

    @Test
    void launch_실패한_Task가_있으면_종료_코드_1() {
        // given
        when(workSource.discoverAll()).thenReturn(twoTasks());
        when(workerPoolFactory.create(any())).thenReturn(
            new SingleThreadWorkerPool(task -> new TaskFailed(task.id(), "broken", false)));

        // when
        LaunchReport report = launcher().launch(RunRequest.defaults(BASE_CONFIG));

        // then
        assertThat(report.result().success()).isFalse();
        assertThat(report.exitCode()).isEqualTo(1);
    }

    @Test
    void launch_Epic_필터가_있으면_해당_Epic만_조회함() {
        // given
        Epic epic = new Epic("epic-1", "Epic one", List.of(Task.ready(TaskId.of("t-1"), "first", 1)));
        when(workSource.discoverEpic("epic-1")).thenReturn(epic);

        // when
        LaunchReport report = launcher().launch(
            RunRequest.defaults(BASE_CONFIG).withEpicFilter("epic-1").withDryRun(true));

        // then
        assertThat(report.manifest().epics()).containsExactly(epic);
        assertThat(report.manifest().totalTasks()).isEqualTo(1);
        verify(workSource, never()).discoverAll();
    }

    @Test
    void launch_작업_조회_실패는_전파됨() {
        // given
        when(workSource.discoverAll()).thenThrow(new WorkSourceException("tracker offline"));

        // when & then
        assertThatThrownBy(() -> launcher().launch(RunRequest.defaults(BASE_CONFIG)))
            .isInstanceOf(WorkSourceException.class);
        verify(checkpointStore, never()).startRun(any(), any());
        verifyNoInteractions(workerPoolFactory);
    }

    @Test
    void status_매니페스트_기준_현황을_반환함() {
        // given
        when(workSource.discoverAll()).thenReturn(twoTasks());

        // when
        ProjectStatus status = launcher().status(null);

        // then
        assertThat(status.total()).isEqualTo(2);
        assertThat(status.ready()).isEqualTo(2);
        assertThat(status.progress()).isZero();
    }
}
