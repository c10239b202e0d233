package com.ryuqq.drover.adapter.runner;

import com.ryuqq.drover.application.claim.ClaimRegistry;
import com.ryuqq.drover.application.runtime.EventChannel;
import com.ryuqq.drover.application.runtime.WorkerPool;
import com.ryuqq.drover.core.spi.TaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 스레드 풀 기반 Worker 풀.
 *
 * <p>시작 시 정확히 workerCount개의 {@link WorkerLoop}를 띄웁니다.
 * Task Runner 호출은 별도의 invocation executor에서 실행되어 Worker가 제한 시간을 강제할 수 있습니다.</p>
 *
 * <p><strong>종료:</strong> {@link #shutdownNow()}는 모든 Worker와 진행 중인 호출을 인터럽트하며
 * 결과를 기다리지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ThreadPoolWorkerPool implements WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(ThreadPoolWorkerPool.class);

    private final TaskRunner taskRunner;
    private final WorkerPoolConfig config;
    private final OutcomeClassifier classifier;
    private final AtomicInteger activeWorkers = new AtomicInteger();

    private ExecutorService workerExecutor;
    private ExecutorService invocationExecutor;

    /**
     * 생성자.
     *
     * @param taskRunner Task 실행기
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ThreadPoolWorkerPool(TaskRunner taskRunner, WorkerPoolConfig config) {
        if (taskRunner == null) {
            throw new IllegalArgumentException("taskRunner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.taskRunner = taskRunner;
        this.config = config;
        this.classifier = new OutcomeClassifier(config.blockerIdPattern());
    }

    @Override
    public synchronized void start(ClaimRegistry claimRegistry, EventChannel eventChannel) {
        if (claimRegistry == null) {
            throw new IllegalArgumentException("claimRegistry cannot be null");
        }
        if (eventChannel == null) {
            throw new IllegalArgumentException("eventChannel cannot be null");
        }
        if (workerExecutor != null) {
            throw new IllegalStateException("Worker pool already started");
        }

        workerExecutor = Executors.newFixedThreadPool(config.workerCount(), daemonThreads("drover-worker-"));
        invocationExecutor = Executors.newCachedThreadPool(daemonThreads("drover-task-"));
        for (int i = 0; i < config.workerCount(); i++) {
            activeWorkers.incrementAndGet();
            workerExecutor.execute(new WorkerLoop("worker-" + i, claimRegistry, eventChannel, taskRunner,
                invocationExecutor, classifier, config, activeWorkers::decrementAndGet));
        }
        log.info("Started {} workers (task timeout: {}s)", config.workerCount(), config.taskTimeout().toSeconds());
    }

    @Override
    public synchronized void shutdownNow() {
        if (workerExecutor == null) {
            return;
        }
        workerExecutor.shutdownNow();
        invocationExecutor.shutdownNow();
        log.debug("Worker pool shut down ({} workers still unwinding)", activeWorkers.get());
    }

    @Override
    public int activeWorkers() {
        return activeWorkers.get();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
