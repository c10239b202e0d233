package com.ryuqq.drover.core.spi;

import com.ryuqq.drover.core.model.Task;

import java.time.Duration;

/**
 * Task Runner SPI: the external mechanism that performs a task (e.g. an agent process).
 *
 * <p>Worker loops call this port once per claim. The call may take a long time; the worker
 * pool enforces the configured task timeout around it and interrupts the calling thread when
 * the deadline passes or the run is cancelled.</p>
 *
 * <p><strong>Blocking Convention:</strong> a failure whose message contains
 * {@code "blocked by <ids>"} is reported as a dependency block, not a failure. Identifiers are
 * extracted from the message by pattern matching (short-prefixed alphanumeric tokens such as
 * {@code bd-a1b2}). This is the only channel that moves a task to BLOCKED.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently by every worker loop</li>
 *   <li>Interruptible: respond to thread interruption by throwing {@link InterruptedException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskRunner {

    /**
     * Performs the task.
     *
     * @param task the claimed task
     * @return the elapsed execution time on success
     * @throws TaskExecutionException if the task failed (message text drives classification)
     * @throws InterruptedException if the invocation was cancelled
     */
    Duration execute(Task task) throws TaskExecutionException, InterruptedException;
}
