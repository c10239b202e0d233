/**
 * Work Model package.
 *
 * <p>This package defines the data structures built once from the Work Source at run
 * start, plus the derived statistics and the final run result.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drover.core.model.TaskId} - Task (and blocker) identifier</li>
 *   <li>{@link com.ryuqq.drover.core.model.RunId} - Run identifier (UUID)</li>
 * </ul>
 *
 * <h2>Work Model</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drover.core.model.Task} - Immutable unit of work</li>
 *   <li>{@link com.ryuqq.drover.core.model.Epic} - Grouping view with derived progress</li>
 *   <li>{@link com.ryuqq.drover.core.model.WorkManifest} - Snapshot of epics and standalone tasks</li>
 *   <li>{@link com.ryuqq.drover.core.model.WorkItem} - Raw Work Source item before mapping</li>
 * </ul>
 *
 * <h2>Derived Views</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drover.core.model.TaskStats} - Per-status counts</li>
 *   <li>{@link com.ryuqq.drover.core.model.ProjectStatus} - Progress summary</li>
 *   <li>{@link com.ryuqq.drover.core.model.RunResult} - Final outcome of a run</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records and final value classes; changes produce copies</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drover.core.model;
