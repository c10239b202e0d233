package com.ryuqq.drover.adapter.runner;

import com.ryuqq.drover.application.claim.ClaimRegistry;
import com.ryuqq.drover.application.runtime.EventChannel;
import com.ryuqq.drover.core.event.TaskFailed;
import com.ryuqq.drover.core.event.WorkerEvent;
import com.ryuqq.drover.core.model.Task;
import com.ryuqq.drover.core.spi.TaskExecutionException;
import com.ryuqq.drover.core.spi.TaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Worker 1개의 실행 루프.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. claim(workerId)
 *    - 없음 + 진행 가능한 작업도 없음 → 은퇴
 *    - 없음 + 다른 Worker가 처리 중 → idleBackoff 대기 후 재시도
 * 2. Task Runner 호출 (invocation executor, taskTimeout 적용)
 * 3. release(workerId)  (결과와 무관하게 항상)
 * 4. 결과를 이벤트 1건으로 변환해 전송
 * </pre>
 *
 * <p>인터럽트되면 진행 중인 호출을 취소하고 이벤트를 보내지 않은 채 종료합니다.
 * 결과 분류 중 런타임 예외가 나면 재시도 불가 TaskFailed를 보내고 루프를 이어갑니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final String workerId;
    private final ClaimRegistry claimRegistry;
    private final EventChannel eventChannel;
    private final TaskRunner taskRunner;
    private final ExecutorService invocationExecutor;
    private final OutcomeClassifier classifier;
    private final WorkerPoolConfig config;
    private final Runnable onExit;

    WorkerLoop(String workerId, ClaimRegistry claimRegistry, EventChannel eventChannel, TaskRunner taskRunner,
               ExecutorService invocationExecutor, OutcomeClassifier classifier, WorkerPoolConfig config,
               Runnable onExit) {
        this.workerId = workerId;
        this.claimRegistry = claimRegistry;
        this.eventChannel = eventChannel;
        this.taskRunner = taskRunner;
        this.invocationExecutor = invocationExecutor;
        this.classifier = classifier;
        this.config = config;
        this.onExit = onExit;
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Optional<Task> claimed = claimRegistry.claim(workerId);
                if (claimed.isEmpty()) {
                    if (!claimRegistry.hasPendingWork()) {
                        log.debug("Worker {} retiring, no reachable work left", workerId);
                        return;
                    }
                    Thread.sleep(config.idleBackoff().toMillis());
                    continue;
                }

                Task task = claimed.get();
                log.info("Worker {} claimed task {}: {}", workerId, task.id(), task.title());
                WorkerEvent event;
                try {
                    event = execute(task);
                } catch (RejectedExecutionException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Worker {} could not classify outcome of task {}", workerId, task.id(), e);
                    event = new TaskFailed(task.id(), "Outcome classification failed: " + describe(e), false);
                } finally {
                    claimRegistry.release(workerId);
                }
                eventChannel.send(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker {} interrupted", workerId);
        } catch (RejectedExecutionException e) {
            log.debug("Worker {} stopped, invocation executor is shut down", workerId);
        } finally {
            onExit.run();
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getName() : e.getMessage();
    }

    WorkerEvent execute(Task task) throws InterruptedException {
        long startNanos = System.nanoTime();
        Future<Duration> invocation = invocationExecutor.submit(() -> taskRunner.execute(task));
        Duration timeout = config.taskTimeout();
        try {
            Duration reported = invocation.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration elapsed = reported != null ? reported : Duration.ofNanos(System.nanoTime() - startNanos);
            return classifier.completed(task.id(), elapsed);
        } catch (TimeoutException e) {
            invocation.cancel(true);
            log.warn("Task {} exceeded timeout of {}s, cancelled", task.id(), timeout.toSeconds());
            return classifier.timedOut(task.id(), timeout);
        } catch (InterruptedException e) {
            invocation.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TaskExecutionException failure) {
                return classifier.failed(task.id(), failure);
            }
            log.warn("Task runner threw unexpectedly for task {}", task.id(), cause);
            return classifier.unexpected(task.id(), cause);
        }
    }
}
