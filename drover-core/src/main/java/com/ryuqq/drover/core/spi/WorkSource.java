package com.ryuqq.drover.core.spi;

import com.ryuqq.drover.core.model.Epic;
import com.ryuqq.drover.core.model.TaskId;
import com.ryuqq.drover.core.model.WorkManifest;

/**
 * Work Source SPI: the external system that enumerates, creates and closes tracked work items.
 *
 * <p>The core consumes this port twice per run: once at start to build the
 * {@link WorkManifest}, and during the run for side effects (closing completed tasks,
 * creating remediation tasks for blockers).</p>
 *
 * <p><strong>Status Mapping:</strong> implementations map their own status vocabulary through
 * {@link com.ryuqq.drover.core.statemachine.TaskStatus#fromWorkSource(String)}:</p>
 * <pre>
 * "open"        → READY
 * "in-progress" → IN_PROGRESS
 * "blocked"     → BLOCKED
 * "closed"      → COMPLETED
 * anything else → READY
 * </pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>Discovery failures are fatal to the run and surface before any worker is spawned</li>
 *   <li>Side-effect failures ({@link #createTask}, {@link #closeTask}) are logged by the
 *       Orchestrator and never escalated</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: discovery runs on the caller thread, side effects on the Orchestrator thread</li>
 *   <li>Failures: throw {@link WorkSourceException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkSource {

    /**
     * Discovers every open epic and standalone task.
     *
     * <p>Completed standalone tasks and fully completed epics are excluded
     * (see {@link WorkManifest#assemble(java.util.List)}).</p>
     *
     * @return the manifest snapshot
     * @throws WorkSourceException if the source cannot be read
     */
    WorkManifest discoverAll();

    /**
     * Discovers a single epic with all of its tasks.
     *
     * @param epicId the epic identifier
     * @return the epic with its tasks
     * @throws IllegalArgumentException if epicId is null or blank
     * @throws WorkSourceException if the epic does not exist or the source cannot be read
     */
    Epic discoverEpic(String epicId);

    /**
     * Creates a new open task.
     *
     * <p>Used for remediation tasks created by auto-unblock.</p>
     *
     * @param title the task title
     * @return the identifier assigned by the source
     * @throws IllegalArgumentException if title is null or blank
     * @throws WorkSourceException if the task cannot be created
     */
    TaskId createTask(String title);

    /**
     * Closes a task.
     *
     * @param id the task identifier
     * @param reason the close reason recorded by the source
     * @throws IllegalArgumentException if id is null
     * @throws WorkSourceException if the task cannot be closed
     */
    void closeTask(TaskId id, String reason);
}
