package com.ryuqq.drover.adapter.runner;

import com.ryuqq.drover.application.orchestrator.OrchestratorConfig;
import com.ryuqq.drover.application.runtime.WorkerPool;
import com.ryuqq.drover.application.runtime.WorkerPoolFactory;
import com.ryuqq.drover.core.spi.TaskRunner;

import java.time.Duration;

/**
 * 실행마다 {@link ThreadPoolWorkerPool}을 만드는 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ThreadPoolWorkerPoolFactory implements WorkerPoolFactory {

    private final TaskRunner taskRunner;
    private final Duration idleBackoff;

    public ThreadPoolWorkerPoolFactory(TaskRunner taskRunner) {
        this(taskRunner, WorkerPoolConfig.DEFAULT_IDLE_BACKOFF);
    }

    public ThreadPoolWorkerPoolFactory(TaskRunner taskRunner, Duration idleBackoff) {
        if (taskRunner == null) {
            throw new IllegalArgumentException("taskRunner cannot be null");
        }
        if (idleBackoff == null) {
            throw new IllegalArgumentException("idleBackoff cannot be null");
        }
        this.taskRunner = taskRunner;
        this.idleBackoff = idleBackoff;
    }

    @Override
    public WorkerPool create(OrchestratorConfig config) {
        return new ThreadPoolWorkerPool(taskRunner, WorkerPoolConfig.from(config).withIdleBackoff(idleBackoff));
    }
}
