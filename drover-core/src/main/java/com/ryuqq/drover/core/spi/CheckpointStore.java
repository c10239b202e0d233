package com.ryuqq.drover.core.spi;

import com.ryuqq.drover.core.model.RunId;
import com.ryuqq.drover.core.model.RunResult;
import com.ryuqq.drover.core.model.WorkManifest;

import java.util.List;
import java.util.Optional;

/**
 * Checkpoint Store SPI: durable audit trail of run start and completion.
 *
 * <p>This port records when a run started (with a snapshot of its manifest) and how it ended.
 * It does not support resuming an interrupted run.</p>
 *
 * <p><strong>Record Lifecycle:</strong></p>
 * <pre>
 * 1. startRun(runId, manifest)  → record created (completedAt = null, success = null)
 * 2. completeRun(runId, result) → completedAt, success, tasksCompleted, tasksFailed set
 * </pre>
 *
 * <p><strong>Backends:</strong> embedded file-based (SQLite) and client/server relational
 * (PostgreSQL) implementations must expose identical record semantics; an in-memory
 * implementation serves tests and embedding. Backends are selected by connection-string
 * scheme, never by branching inside the core.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from any thread</li>
 *   <li>Failures: throw {@link CheckpointException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CheckpointStore {

    /**
     * Prepares the backend (creates the schema if missing).
     *
     * <p>Idempotent: calling it on an initialized backend is a no-op.</p>
     *
     * @throws CheckpointException if the backend is unreachable or the schema cannot be created
     */
    void init();

    /**
     * Records the start of a run.
     *
     * @param runId the run identifier
     * @param manifest the manifest snapshot the run was started with
     * @throws IllegalArgumentException if runId or manifest is null
     * @throws CheckpointException if a record with the same id exists or the write fails
     */
    void startRun(RunId runId, WorkManifest manifest);

    /**
     * Records the completion of a run.
     *
     * @param runId the run identifier
     * @param result the final result
     * @throws IllegalArgumentException if runId or result is null
     * @throws CheckpointException if the run was never started or the write fails
     */
    void completeRun(RunId runId, RunResult result);

    /**
     * Lists recorded runs, most recent first.
     *
     * @return run records ordered by startedAt descending
     * @throws CheckpointException if the read fails
     */
    List<RunRecord> listRuns();

    /**
     * Fetches a single run.
     *
     * @param runId the run identifier
     * @return the record, or empty if unknown
     * @throws IllegalArgumentException if runId is null
     * @throws CheckpointException if the read fails
     */
    Optional<RunRecord> getRun(RunId runId);
}
