package com.ryuqq.drover.application.launcher;

import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.model.WorkManifest;

/**
 * 실행 요청 처리 결과.
 *
 * <p>dry run이면 runId와 result가 null입니다.</p>
 *
 * @param runId 실행 ID (dry run이면 null)
 * @param manifest 조회된 매니페스트
 * @param result 실행 결과 (dry run이면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchReport(
    RunId runId,
    WorkManifest manifest,
    RunResult result
) {

    public LaunchReport {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if ((runId == null) != (result == null)) {
            throw new IllegalArgumentException("runId and result must be both present or both absent");
        }
    }

    public static LaunchReport dryRun(WorkManifest manifest) {
        return new LaunchReport(null, manifest, null);
    }

    public static LaunchReport completed(RunId runId, WorkManifest manifest, RunResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return new LaunchReport(runId, manifest, result);
    }

    public boolean isDryRun() {
        return result == null;
    }

    /**
     * 프로세스 종료 코드.
     *
     * @return dry run 또는 성공한 실행이면 0, 그 외 1
     */
    public int exitCode() {
        return isDryRun() || result.success() ? 0 : 1;
    }
}
