package com.ryuqq.drover.application.runtime;

import com.ryuqq.drover.application.orchestrator.OrchestratorConfig;

/**
 * 실행(run)마다 새 {@link WorkerPool}을 만드는 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkerPoolFactory {

    WorkerPool create(OrchestratorConfig config);
}
