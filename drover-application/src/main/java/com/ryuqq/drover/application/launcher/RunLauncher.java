package com.ryuqq.drover.application.launcher;

import com.ryuqq.drover.application.orchestrator.Orchestrator;
import com.ryuqq.drover.application.orchestrator.OrchestratorConfig;
import com.ryuqq.drover.application.runtime.WorkerPoolFactory;
import com.ryuqq.drover.core.model.ProjectStatus;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.model.WorkManifest;
import com.ryuqq.drover.core.spi.CheckpointStore;
import com.ryuqq.drover.core.spi.WorkSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 실행 진입점 (경계 Facade).
 *
 * <p>저장소 초기화, 작업 조회, Orchestrator 구성과 실행을 하나의 호출로 묶습니다.
 * 외부 CLI나 서버는 이 클래스만 알면 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunLauncher {

    private static final Logger log = LoggerFactory.getLogger(RunLauncher.class);

    private final WorkSource workSource;
    private final CheckpointStore checkpointStore;
    private final WorkerPoolFactory workerPoolFactory;
    private final OrchestratorConfig baseConfig;

    /**
     * 생성자.
     *
     * @param workSource 작업 출처
     * @param checkpointStore 실행 기록 저장소
     * @param workerPoolFactory Worker 풀 팩토리
     * @param baseConfig 기준 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RunLauncher(WorkSource workSource, CheckpointStore checkpointStore,
                       WorkerPoolFactory workerPoolFactory, OrchestratorConfig baseConfig) {
        if (workSource == null) {
            throw new IllegalArgumentException("workSource cannot be null");
        }
        if (checkpointStore == null) {
            throw new IllegalArgumentException("checkpointStore cannot be null");
        }
        if (workerPoolFactory == null) {
            throw new IllegalArgumentException("workerPoolFactory cannot be null");
        }
        if (baseConfig == null) {
            throw new IllegalArgumentException("baseConfig cannot be null");
        }
        this.workSource = workSource;
        this.checkpointStore = checkpointStore;
        this.workerPoolFactory = workerPoolFactory;
        this.baseConfig = baseConfig;
    }

    /**
     * 실행 요청 처리.
     *
     * @param request 실행 요청
     * @return 처리 결과
     * @throws com.ryuqq.drover.core.spi.CheckpointException 저장소 초기화/기록 실패 시
     * @throws com.ryuqq.drover.core.spi.WorkSourceException 작업 조회 실패 시
     */
    public LaunchReport launch(RunRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        checkpointStore.init();

        WorkManifest manifest = discover(request.epicFilter());
        log.info("Discovered {}: {} tasks ({} ready, {} blocked, {} completed)", manifest.targetDescription(),
            manifest.totalTasks(), manifest.readyTasks(), manifest.blockedTasks(), manifest.completedTasks());

        if (request.dryRun()) {
            log.info("Dry run, no tasks executed");
            return LaunchReport.dryRun(manifest);
        }

        OrchestratorConfig config = request.applyTo(baseConfig);
        Orchestrator orchestrator = new Orchestrator(
            manifest, config, workSource, checkpointStore, workerPoolFactory.create(config));
        RunResult result = orchestrator.run();
        return LaunchReport.completed(orchestrator.runId(), manifest, result);
    }

    /**
     * 현재 작업 현황 조회.
     *
     * @param epicFilter 대상 Epic ID (null이면 전체)
     * @return 현황
     */
    public ProjectStatus status(String epicFilter) {
        return ProjectStatus.from(discover(epicFilter));
    }

    private WorkManifest discover(String epicFilter) {
        if (epicFilter == null || epicFilter.isBlank()) {
            return workSource.discoverAll();
        }
        return WorkManifest.ofEpic(workSource.discoverEpic(epicFilter.trim()));
    }
}
